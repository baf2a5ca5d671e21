package com.wp.verifier.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wp.verifier.model.MethodContract;
import com.wp.verifier.model.Parameter;
import com.wp.verifier.model.Type;
import com.wp.verifier.visitor.ExpressionLowering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads contracts of external methods from JSON.
 *
 * <pre>
 * {"externalMethods": [
 *   {"name": "abs", "parameters": [{"name": "x", "type": "int"}], "returns": "int",
 *    "preconditions": [], "postconditions": ["result >= 0"]}
 * ]}
 * </pre>
 *
 * Parameter types default to {@code int}; {@code returns} may be omitted for methods without a
 * result. Predicates use the same syntax as {@code @Requires}/{@code @Ensures}.
 */
public class ContractFileReader {

    private static final Logger logger = LoggerFactory.getLogger(ContractFileReader.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Loads every contract of the file into the cache.
     *
     * @return number of contracts loaded
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public int loadContracts(Path file, ContractCache cache) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return loadContracts(in, file.toString(), cache);
        }
    }

    public int loadContracts(InputStream in, String origin, ContractCache cache) throws IOException {
        ContractFile contents = mapper.readValue(in, ContractFile.class);
        int loaded = 0;
        if (contents.externalMethods == null) {
            logger.warn("No externalMethods in {}", origin);
            return 0;
        }
        for (ExternalMethod method : contents.externalMethods) {
            try {
                cache.put(toContract(method));
                loaded++;
            } catch (IllegalArgumentException e) {
                logger.error("Skipping contract in {}: {}", origin, e.getMessage());
            }
        }
        logger.info("Loaded {} external contract(s) from {}", loaded, origin);
        return loaded;
    }

    MethodContract toContract(ExternalMethod method) {
        if (method.name == null || method.name.isBlank()) {
            throw new IllegalArgumentException("contract without a method name");
        }
        ExpressionLowering expressions = new ExpressionLowering();
        List<Parameter> parameters = new ArrayList<>();
        if (method.parameters != null) {
            for (ExternalParameter parameter : method.parameters) {
                Type type = parseType(parameter.type, method.name);
                parameters.add(new Parameter(parameter.name, type));
                expressions.declare(parameter.name, type);
            }
        }
        Type returnType = method.returns == null ? null : parseType(method.returns, method.name);
        if (returnType != null) {
            expressions.declare("result", returnType);
        }

        MethodContract contract = new MethodContract(method.name, parameters, returnType, MethodContract.Origin.EXTERNAL);
        if (method.preconditions != null) {
            for (String pre : method.preconditions) {
                contract.addPrecondition(expressions.parsePredicate(pre));
            }
        }
        if (method.postconditions != null) {
            for (String post : method.postconditions) {
                contract.addPostcondition(expressions.parsePredicate(post));
            }
        }
        return contract;
    }

    private static Type parseType(String text, String method) {
        if (text == null) {
            return Type.INT;
        }
        switch (text.toLowerCase(Locale.ROOT)) {
            case "int":
            case "integer":
            case "long":
            case "i32":
            case "i64":
            case "u32":
            case "u64":
            case "usize":
                return Type.INT;
            case "bool":
            case "boolean":
                return Type.BOOL;
            default:
                throw new IllegalArgumentException("unsupported type '" + text + "' in contract of " + method);
        }
    }

    /**
     * Root of a contracts file.
     */
    static class ContractFile {
        @JsonProperty("externalMethods")
        List<ExternalMethod> externalMethods;
    }

    static class ExternalMethod {
        @JsonProperty("name")
        String name;

        @JsonProperty("parameters")
        List<ExternalParameter> parameters;

        @JsonProperty("returns")
        String returns;

        @JsonProperty("preconditions")
        List<String> preconditions;

        @JsonProperty("postconditions")
        List<String> postconditions;
    }

    static class ExternalParameter {
        @JsonProperty("name")
        String name;

        @JsonProperty("type")
        String type;
    }
}
