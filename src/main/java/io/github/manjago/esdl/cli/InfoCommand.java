package io.github.manjago.esdl.cli;

import io.github.manjago.esdl.config.ExperimentConfig;
import io.github.manjago.esdl.landscape.Landscapes;
import io.github.manjago.esdl.ops.OperatorDescriptor;
import io.github.manjago.esdl.ops.OperatorRegistry;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show version, default configuration and the registered operators.
 */
@Command(
    name = "info",
    description = "Show version, defaults and registered operators",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("ESDL 1.0.0 - evolutionary systems definition language");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(ExperimentConfig.defaults());

        OperatorRegistry registry = OperatorRegistry.withBuiltins();
        printOperators(registry, OperatorDescriptor.Role.GENERATOR, "Generators (FROM):");
        printOperators(registry, OperatorDescriptor.Role.FILTER, "Filters (USING):");

        System.out.println("Landscapes: " + String.join(", ", Landscapes.NAMES) + ", " + Landscapes.NONE);
        return 0;
    }

    private static void printOperators(OperatorRegistry registry, OperatorDescriptor.Role role, String title) {
        System.out.println(title);
        for (OperatorDescriptor descriptor : registry.all()) {
            if (descriptor.role() == role) {
                System.out.printf("  %s%n      %s%n", descriptor.signature(), descriptor.description());
            }
        }
        System.out.println();
    }
}
