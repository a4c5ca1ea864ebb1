package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.evaluator.EvaluationContext;

import java.util.Collections;
import java.util.Map;

/**
 * What is in effect while a statement renders: the variable scope, the inherited normalized
 * style and the accumulated scope transformation.
 */
public record RenderScope(EvaluationContext.Scope variables, Map<String, Object> style, Transform transform) {

    public RenderScope {
        style = Collections.unmodifiableMap(style);
    }

    public RenderScope withVariables(EvaluationContext.Scope scope) {
        return new RenderScope(scope, style, transform);
    }

    public RenderScope withStyle(Map<String, Object> merged) {
        return new RenderScope(variables, merged, transform);
    }

    public RenderScope withTransform(Transform inner) {
        return new RenderScope(variables, style, transform.then(inner));
    }
}
