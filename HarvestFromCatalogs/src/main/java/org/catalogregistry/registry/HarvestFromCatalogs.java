package org.catalogregistry.registry;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.catalogregistry.csw.reader.FileRecordSource;
import org.catalogregistry.harvest.pipeline.HarvestScheduler;
import org.catalogregistry.harvest.pipeline.errors.HarvestException;
import org.catalogregistry.harvest.pipeline.ir.PassSummary;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;
import org.catalogregistry.harvest.pipeline.sysprof.SysprofRegistrar;
import org.catalogregistry.registry.common.index.CatalogIndexManager;

import lombok.extern.slf4j.Slf4j;

/**
 * Command line entry point of the registry.
 *
 * <ul>
 *   <li>{@code setup_db} creates the record store tables</li>
 *   <li>{@code get_sysprof} registers and prints the service profile</li>
 *   <li>{@code harvest [-s source]} runs one pass of every configured source</li>
 *   <li>{@code load_records -p path -s catalog} adds the records of CSW transaction files to a catalog</li>
 *   <li>{@code rebuild_index [-s source]} re-projects stored records into the search index</li>
 * </ul>
 *
 * Exits with 0 when everything completed, 1 when any source or step failed and 2 on usage errors.
 */
@Slf4j
public class HarvestFromCatalogs {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, RegistryContext::new));
    }

    @FunctionalInterface
    interface ContextFactory {
        RegistryContext create(RegistryConfig config) throws HarvestException;
    }

    static int run(String[] args, Map<String, String> env, PrintStream out, ContextFactory contexts) {
        CommandLine commandLine;
        RegistryConfig config;
        try {
            commandLine = CommandLine.parse(args);
            var configFile = commandLine.configFile();
            if (configFile == null && env.get(RegistryConfig.ENV_CONFIG) != null) {
                configFile = Path.of(env.get(RegistryConfig.ENV_CONFIG));
            }
            config = RegistryConfig.load(configFile, env);
        } catch (UsageException e) {
            out.println(e.getMessage());
            out.println(CommandLine.USAGE);
            return EXIT_USAGE;
        } catch (IOException | IllegalArgumentException e) {
            log.atError().setMessage("Cannot read configuration").setCause(e).log();
            out.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        log.info("Running {}", commandLine.command());
        try (var context = contexts.create(config)) {
            switch (commandLine.command()) {
                case CommandLine.SETUP_DB:
                    return setupDb(context, out);
                case CommandLine.GET_SYSPROF:
                    return getSysprof(context, out);
                case CommandLine.HARVEST:
                    return harvest(context, commandLine.selector(), out);
                case CommandLine.LOAD_RECORDS:
                    return loadRecords(context, commandLine.path(), commandLine.selector(), out);
                case CommandLine.REBUILD_INDEX:
                    return rebuildIndex(context, commandLine.selector(), out);
                default:
                    throw new IllegalStateException("Unhandled command " + commandLine.command());
            }
        } catch (UsageException e) {
            out.println(e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            log.atError().setMessage("Invalid settings for {}").addArgument(commandLine::command).setCause(e).log();
            out.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        } catch (HarvestException e) {
            log.atError().setMessage("{} failed").addArgument(commandLine::command).setCause(e).log();
            out.println(commandLine.command() + " failed (" + e.getKind() + "): " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static int setupDb(RegistryContext context, PrintStream out) throws HarvestException {
        context.getStore().initializeSchema();
        out.println("Record store ready: " + context.getConfig().getDatabaseUrl());
        return EXIT_OK;
    }

    static int getSysprof(RegistryContext context, PrintStream out) throws HarvestException {
        context.getStore().initializeSchema();
        var registrar = context.sysprof();
        var change = registrar.register();
        log.info("Service profile {} is {}", SysprofRegistrar.IDENTIFIER, change.type());
        out.println(toPrettyJson(registrar.describe()));
        return EXIT_OK;
    }

    static int harvest(RegistryContext context, String sourceName, PrintStream out)
        throws HarvestException, UsageException {
        var endpoints = selectEndpoints(context.getConfig(), sourceName);
        context.getStore().initializeSchema();
        List<PassSummary> summaries = context.scheduler().harvestAll(endpoints).collectList().block();
        if (summaries == null) {
            summaries = List.of();
        }
        summaries.forEach(out::println);
        return HarvestScheduler.exitCode(summaries);
    }

    static List<SourceEndpoint> selectEndpoints(RegistryConfig config, String sourceName) throws UsageException {
        List<SourceEndpoint> endpoints;
        try {
            endpoints = config.endpoints();
        } catch (IllegalArgumentException e) {
            throw new UsageException("Invalid source configuration: " + e.getMessage());
        }
        if (sourceName != null) {
            endpoints = endpoints.stream().filter(e -> e.name().equals(sourceName)).toList();
            if (endpoints.isEmpty()) {
                throw new UsageException("No configured source named " + sourceName);
            }
        }
        if (endpoints.isEmpty()) {
            throw new UsageException("No sources configured");
        }
        return endpoints;
    }

    static int loadRecords(RegistryContext context, String path, String catalog, PrintStream out)
        throws HarvestException, UsageException {
        try {
            CatalogIndexManager.validateCatalogName(catalog);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
        if (SourceEndpoint.isReserved(catalog)) {
            throw new UsageException("Catalog name " + catalog + " is reserved for the service profile");
        }
        // Loaded records share the catalog's namespace; a harvested source of that name would delete them
        var sources = context.getConfig().getSources();
        var configured = sources != null && sources.stream().anyMatch(s -> catalog.equals(s.getName()));
        if (configured) {
            throw new UsageException("Catalog " + catalog + " is harvested by the configured source of that name; "
                + "load into another catalog");
        }
        context.getStore().initializeSchema();
        if (context.getCatalogs().createCatalog(catalog)) {
            out.println("Created catalog " + catalog);
        }
        var endpoint = SourceEndpoint.builder()
            .name(catalog)
            .type(FileRecordSource.TYPE)
            .location(path)
            .catalog(catalog)
            .build();
        var summary = context.getOrchestrator().harvest(endpoint);
        out.println(summary);
        return summary.isCompleted() ? EXIT_OK : EXIT_FAILED;
    }

    /** The service profile is not a catalog record and never gets an index document. */
    static int rebuildIndex(RegistryContext context, String sourceName, PrintStream out) throws HarvestException {
        var store = context.getStore();
        store.initializeSchema();
        var sources = new ArrayList<>(store.listSources());
        sources.remove(SysprofRegistrar.SOURCE);
        if (sourceName != null) {
            sources.retainAll(List.of(sourceName));
        }
        Function<String, String> catalogOf = context.getConfig()::catalogOf;
        var rebuilder = context.rebuilder();
        var exitCode = EXIT_OK;
        for (var source : sources) {
            var result = rebuilder.rebuildSource(catalogOf.apply(source), source);
            out.println("Rebuilt " + result.indexed() + " documents of " + source
                + (result.failures().isEmpty() ? "" : ", " + result.failures().size() + " rejected"));
            if (result.failures().isEmpty()) {
                store.saveState(store.loadState(source).withIndexDirty(false));
            } else {
                result.failures().forEach(f -> log.warn("Rejected {}: {}", f.reference(), f.message()));
                exitCode = EXIT_FAILED;
            }
        }
        return exitCode;
    }

    private static String toPrettyJson(Object value) {
        try {
            return PRETTY_MAPPER.writeValueAsString(value);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot render " + value, e);
        }
    }
}
