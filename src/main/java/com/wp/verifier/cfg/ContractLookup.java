package com.wp.verifier.cfg;

import com.wp.verifier.model.MethodContract;

/**
 * Source of contracts for called methods.
 */
@FunctionalInterface
public interface ContractLookup {

    /**
     * Resolves an unqualified call made from a method of {@code owner}.
     *
     * @param owner the declaring type of the caller, or {@code null} if it has none
     * @return the contract of {@code name} taking {@code arity} arguments, or {@code null} if none is known
     */
    MethodContract find(String owner, String name, int arity);

    static ContractLookup none() {
        return (owner, name, arity) -> null;
    }
}
