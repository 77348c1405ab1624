package com.vidnyan.aro.domain.analysis;

import com.vidnyan.aro.domain.model.SourceSpan;

import java.util.List;

/**
 * What one statement consumes, produces and does to the outside world.
 *
 * @param label       short statement label, usually the action verb
 * @param sideEffects tags such as {@code emit:UserCreated}, {@code return:OK} or {@code parallel}
 */
public record DataFlowInfo(
    String label,
    SourceSpan span,
    List<String> inputs,
    List<String> outputs,
    List<String> sideEffects
) {

    public DataFlowInfo {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        sideEffects = List.copyOf(sideEffects);
    }

    public String format() {
        return label + ": inputs=" + inputs + " outputs=" + outputs + " effects=" + sideEffects;
    }
}
