package org.pdemeta.api;

import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;

import java.util.List;

/**
 * A function tag was applied with two incompatible coordinate signatures. The engine does
 * not guess which one was meant.
 */
public class SignatureInconsistencyException extends AnalysisException {

    private final FunctionTag function;
    private final List<Symbol> firstSignature;
    private final List<Symbol> conflictingSignature;

    public SignatureInconsistencyException(FunctionTag function, List<Symbol> firstSignature, List<Symbol> conflictingSignature) {
        super(AnalysisErrorCode.SIGNATURE_INCONSISTENT,
                String.format("Function '%s' is applied as %s%s and as %s%s; one signature per function is required.",
                        function, function, firstSignature, function, conflictingSignature));
        this.function = function;
        this.firstSignature = List.copyOf(firstSignature);
        this.conflictingSignature = List.copyOf(conflictingSignature);
    }

    public FunctionTag getFunction() {
        return function;
    }

    public List<Symbol> getFirstSignature() {
        return firstSignature;
    }

    public List<Symbol> getConflictingSignature() {
        return conflictingSignature;
    }
}
