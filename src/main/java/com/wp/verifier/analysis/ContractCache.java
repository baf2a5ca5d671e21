package com.wp.verifier.analysis;

import com.wp.verifier.ast.FunctionDecl;
import com.wp.verifier.cfg.ContractLookup;
import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.MethodContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Cache of method contracts, keyed by declaring type, method name and arity.
 * Lets a caller be verified against the contracts of the methods it calls instead of their bodies.
 *
 * <p>Declared contracts belong to their declaring type and only summarise unqualified calls made
 * from that type. External contracts have no owner and cover any caller whose own type does not
 * declare a method of the same name and arity.
 */
public class ContractCache implements ContractLookup {

    private static final Logger logger = LoggerFactory.getLogger(ContractCache.class);

    private final Map<String, MethodContract> cache = new HashMap<>();

    // Secondary index: method name -> signatures of all its overloads
    private final Map<String, List<String>> methodNameIndex = new HashMap<>();

    // Owner-scoped signatures of every registered method, with or without a contract
    private final Set<String> members = new HashSet<>();

    /**
     * Stores a contract, replacing any earlier one with the same owner, name and arity.
     */
    public void put(MethodContract contract) {
        String signature = createSignature(contract.getOwner(), contract.getName(), contract.getArity());
        MethodContract previous = cache.put(signature, contract);
        if (previous == null) {
            methodNameIndex.computeIfAbsent(contract.getName(), k -> new ArrayList<>()).add(signature);
            logger.debug("Cached contract for: {}", signature);
        } else {
            logger.info("Contract for {} ({}) replaces the {} one", signature, contract.getOrigin(),
                    previous.getOrigin());
        }
    }

    /**
     * Caches the declared contract of a function. Functions without any explicit pre- or
     * postcondition are not cached, so calls to them stay uninterpreted. A function with an owner is
     * recorded as a member of its type either way, which hides external contracts of the same name
     * and arity from callers in that type.
     *
     * @return true if a contract was cached
     */
    public boolean register(FunctionDecl function) {
        if (function.getOwner() != null) {
            members.add(createSignature(function.getOwner(), function.getName(), function.getParameters().size()));
        }
        MethodContract contract = new MethodContract(function.getOwner(), function.getName(),
                function.getParameters(), function.getReturnType(), MethodContract.Origin.DECLARED);
        for (Annotation precondition : function.getPreconditions()) {
            if (!precondition.isImplicit()) {
                contract.addPrecondition(precondition.getPredicate());
            }
        }
        Annotation postcondition = function.getPostcondition();
        if (postcondition != null && !postcondition.isImplicit()) {
            contract.addPostcondition(postcondition.getPredicate());
        }
        if (contract.isEmpty()) {
            return false;
        }
        put(contract);
        return true;
    }

    @Override
    public MethodContract find(String owner, String name, int arity) {
        if (owner != null) {
            String scoped = createSignature(owner, name, arity);
            if (members.contains(scoped) || cache.containsKey(scoped)) {
                return cache.get(scoped);
            }
        }
        return cache.get(createSignature(name, arity));
    }

    /**
     * Finds a contract that has no owner, such as one loaded from a contracts file.
     */
    public MethodContract find(String name, int arity) {
        return find(null, name, arity);
    }

    /**
     * Gets all contracts cached for a method name, whatever their arity.
     */
    public List<MethodContract> findByMethodName(String name) {
        List<MethodContract> result = new ArrayList<>();
        for (String signature : methodNameIndex.getOrDefault(name, Collections.emptyList())) {
            result.add(cache.get(signature));
        }
        return result;
    }

    public boolean contains(String name, int arity) {
        return contains(null, name, arity);
    }

    /**
     * @return true if a contract is cached under exactly this owner, name and arity
     */
    public boolean contains(String owner, String name, int arity) {
        return cache.containsKey(createSignature(owner, name, arity));
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
        methodNameIndex.clear();
        members.clear();
        logger.debug("Cleared contract cache");
    }

    public Map<String, MethodContract> getAll() {
        return Collections.unmodifiableMap(cache);
    }

    /**
     * Creates the cache key of a method, e.g. {@code "clamp/3"}.
     */
    public static String createSignature(String name, int arity) {
        return name + "/" + arity;
    }

    /**
     * Creates the cache key of a method of a type, e.g. {@code "com.acme.Calc.clamp/3"}.
     */
    public static String createSignature(String owner, String name, int arity) {
        return owner == null ? createSignature(name, arity) : owner + "." + name + "/" + arity;
    }
}
