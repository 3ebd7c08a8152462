package com.raditha.sentinel.scanner;

import com.raditha.sentinel.model.AnalysisModel;
import com.raditha.sentinel.model.Contract;
import com.raditha.sentinel.model.Function;
import com.raditha.sentinel.model.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds property-test functions a fuzzer can call directly.
 * <p>
 * A fuzzer deploys only contracts whose constructor takes no arguments, and calls public
 * read-only functions whose name carries the property prefix.
 */
public class EntryPointScanner {

    public static final String DEFAULT_PREFIX = "echidna_";

    private static final Logger logger = LoggerFactory.getLogger(EntryPointScanner.class);

    private final String prefix;

    public EntryPointScanner() {
        this(DEFAULT_PREFIX);
    }

    public EntryPointScanner(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Entry point prefix cannot be empty");
        }
        this.prefix = prefix;
    }

    public EntryPointReport scan(AnalysisModel model) {
        List<ContractEntryPoints> groups = new ArrayList<>();
        for (Contract contract : model.contracts()) {
            if (!isDeployable(contract)) {
                logger.debug("Skipping {}: constructor takes arguments", contract.name());
                continue;
            }
            List<String> entryPoints = contract.functions().stream()
                    .filter(this::isEntryPoint)
                    .map(f -> contract.name() + "." + f.fullName())
                    .toList();
            if (!entryPoints.isEmpty()) {
                List<String> bases = contract.immediateInheritance().stream()
                        .map(Contract::name)
                        .toList();
                groups.add(new ContractEntryPoints(contract.name(), bases, entryPoints));
            }
        }
        logger.debug("Found {} entry point contract(s) with prefix {}", groups.size(), prefix);
        return new EntryPointReport(prefix, groups);
    }

    private static boolean isDeployable(Contract contract) {
        return contract.constructor()
                .map(c -> c.parameterTypes().isEmpty())
                .orElse(true);
    }

    boolean isEntryPoint(Function function) {
        return function.name().startsWith(prefix)
                && function.mutability().isReadOnly()
                && function.visibility() == Visibility.PUBLIC;
    }
}
