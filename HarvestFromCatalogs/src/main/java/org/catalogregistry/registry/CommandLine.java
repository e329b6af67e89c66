package org.catalogregistry.registry;

import java.nio.file.Path;
import java.util.List;

/**
 * Parsed arguments of the registry tool.
 *
 * Both {@code <command> [options]} and the {@code pycsw -c <command> [options]}
 * forms are accepted. Options: {@code -p <path>}, {@code -s <catalog or source>},
 * {@code -f <config file>}.
 */
public record CommandLine(
    String command,
    String path,
    String selector,
    Path configFile
) {
    public static final String SETUP_DB = "setup_db";
    public static final String GET_SYSPROF = "get_sysprof";
    public static final String HARVEST = "harvest";
    public static final String LOAD_RECORDS = "load_records";
    public static final String REBUILD_INDEX = "rebuild_index";

    public static final List<String> COMMANDS = List.of(SETUP_DB, GET_SYSPROF, HARVEST, LOAD_RECORDS, REBUILD_INDEX);

    public static final String USAGE = "Usage: HarvestFromCatalogs <command> [-f config.yml] [-p path] [-s name]\n"
        + "       HarvestFromCatalogs pycsw -c <command> [-f config.yml] [-p path] [-s name]\n"
        + "Commands: " + String.join(", ", COMMANDS);

    public static CommandLine parse(String[] args) throws UsageException {
        if (args.length == 0) {
            throw new UsageException("No command given");
        }
        String command = null;
        int i = 0;
        if ("pycsw".equals(args[0])) {
            i = 1;
        } else if (!args[0].startsWith("-")) {
            command = args[0];
            i = 1;
        }
        String path = null;
        String selector = null;
        Path configFile = null;
        for (; i < args.length; i++) {
            var option = args[i];
            if (i + 1 >= args.length) {
                throw new UsageException("Option " + option + " needs a value");
            }
            var value = args[++i];
            switch (option) {
                case "-c":
                    command = value;
                    break;
                case "-p":
                    path = value;
                    break;
                case "-s":
                    selector = value;
                    break;
                case "-f":
                    configFile = Path.of(value);
                    break;
                default:
                    throw new UsageException("Unknown option " + option);
            }
        }
        if (command == null) {
            throw new UsageException("No command given");
        }
        if (!COMMANDS.contains(command)) {
            throw new UsageException("Unsupported command '" + command + "'; supported commands are " + COMMANDS);
        }
        if (LOAD_RECORDS.equals(command)) {
            if (path == null) {
                throw new UsageException("load_records needs the records path (-p)");
            }
            if (selector == null) {
                throw new UsageException("load_records needs the catalog (-s)");
            }
        }
        return new CommandLine(command, path, selector, configFile);
    }
}
