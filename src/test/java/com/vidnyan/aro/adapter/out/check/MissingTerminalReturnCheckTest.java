package com.vidnyan.aro.adapter.out.check;

import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MissingTerminalReturnCheckTest {

    private final MissingTerminalReturnCheck check = new MissingTerminalReturnCheck();

    @Test
    void check_ShouldWarnWhenNothingEndsTheFeatureSet() {
        // Arrange
        String source = """
                (Fire And Forget: Demo) {
                    Log "started" to the <console>.
                }
                (Proper: Demo) {
                    Return an <OK: status> for the <request>.
                }
                """;

        // Act
        List<Diagnostic> findings = check.check(CheckTestSupport.context(source));

        // Assert
        assertEquals(1, findings.size());
        assertEquals(DiagnosticKind.MISSING_TERMINAL_RETURN, findings.get(0).kind());
        assertTrue(findings.get(0).message().contains("no Return"));
        assertTrue(findings.get(0).message().contains("Fire And Forget"));
    }

    @Test
    void check_GuardedReturnAndLoopsShouldNotCount() {
        // Act
        List<Diagnostic> findings = check.check(CheckTestSupport.context("""
                (Maybe: Demo) {
                    Return an <OK: status> for the <request> when <request> exists.
                    for each <x> in <request: items> { Return an <OK: status> for the <x>. }
                }
                """));

        // Assert
        assertEquals(1, findings.size());
    }

    @Test
    void check_PipelineEndingInReturnShouldCount() {
        // Act
        List<Diagnostic> findings = check.check(CheckTestSupport.context("""
                (Flow: Demo) {
                    Extract the <a> from the <request> -> Return an <OK: status> for the <a>.
                }
                """));

        // Assert
        assertTrue(findings.isEmpty());
    }

    @Test
    void check_ReturnBeforeTheLastStatementShouldNotCount() {
        // Act
        List<Diagnostic> findings = check.check(CheckTestSupport.context("""
                (Early: Demo) {
                    Return an <OK: status> for the <request>.
                    Log "x" to <console>.
                }
                """));

        // Assert
        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("'Early'"));
    }

    @Test
    void check_MatchShouldCountOnlyWhenEveryBranchEndsInReturn() {
        // Act
        List<Diagnostic> findings = check.check(CheckTestSupport.context("""
                (Ends: Demo) {
                    match <request: mode> {
                        case "a" { Return an <OK: status> for the <request>. }
                        otherwise { Throw a <BadRequest: error> for the <request>. }
                    }
                }
                (Leaks: Demo) {
                    match <request: mode> {
                        case "a" { Return an <OK: status> for the <request>. Log "a" to <console>. }
                        otherwise { Return an <OK: status> for the <request>. }
                    }
                }
                """));

        // Assert
        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("'Leaks'"));
    }
}
