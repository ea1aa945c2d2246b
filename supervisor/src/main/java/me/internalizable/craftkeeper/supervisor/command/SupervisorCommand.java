package me.internalizable.craftkeeper.supervisor.command;

import me.internalizable.craftkeeper.api.supervisor.ResourceSnapshot;
import me.internalizable.craftkeeper.api.supervisor.ServerKind;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import me.internalizable.craftkeeper.api.supervisor.StatusSnapshot;
import me.internalizable.craftkeeper.api.supervisor.SupervisorAPI;
import me.internalizable.craftkeeper.api.supervisor.SupervisorException;
import me.internalizable.craftkeeper.supervisor.ServerSupervisor;
import me.internalizable.craftkeeper.supervisor.registry.ServerRegistry;
import me.internalizable.craftkeeper.supervisor.store.ServerDefinition;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Operator console command for managing supervised servers.
 *
 * <p>Usage:</p>
 * <ul>
 *   <li>{@code list [state]} - List servers</li>
 *   <li>{@code info <server>} - Server details</li>
 *   <li>{@code create <name> <jar> [options]} - Provision a server</li>
 *   <li>{@code start|stop|restart|kill <server>} - Lifecycle control</li>
 *   <li>{@code delete <server> [--purge]} - Remove a server</li>
 *   <li>{@code send <server> <command...>} - Write to the server console</li>
 *   <li>{@code logs <server> [--tail=N]} - View recent output</li>
 *   <li>{@code players <server>} - Connected players</li>
 *   <li>{@code stats} - Show statistics</li>
 * </ul>
 *
 * <p>A server may be named by its id, a unique id prefix or its display name.</p>
 */
public class SupervisorCommand {

    private static final String SEPARATOR = "------------------------------";
    private static final int DEFAULT_TAIL = 20;

    private final ServerSupervisor supervisor;
    private final PrintStream out;

    public SupervisorCommand(@Nonnull ServerSupervisor supervisor, @Nonnull PrintStream out) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Execute a whitespace separated command line.
     *
     * @param line command line
     * @return command result
     */
    @Nonnull
    public CommandResult execute(@Nonnull String line) {
        String trimmed = line.trim();
        return execute(trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+"));
    }

    @Nonnull
    public CommandResult execute(@Nonnull String[] args) {
        if (!supervisor.isInitialized() || supervisor.isShutdown()) {
            error("Supervisor is not running.");
            return CommandResult.failure("Supervisor not running");
        }

        if (args.length == 0) {
            return showHelp();
        }

        String subCommand = args[0].toLowerCase(Locale.ROOT);
        String[] subArgs = args.length > 1 ? Arrays.copyOfRange(args, 1, args.length) : new String[0];

        return switch (subCommand) {
            case "list", "ls" -> listServers(subArgs);
            case "info", "i" -> showInfo(subArgs);
            case "create" -> createServer(subArgs);
            case "start" -> lifecycle(subArgs, "start");
            case "stop" -> lifecycle(subArgs, "stop");
            case "restart" -> lifecycle(subArgs, "restart");
            case "kill" -> lifecycle(subArgs, "kill");
            case "delete", "rm" -> deleteServer(subArgs);
            case "send", "cmd" -> sendCommand(subArgs);
            case "logs", "log" -> showLogs(subArgs);
            case "players" -> showPlayers(subArgs);
            case "stats", "status" -> showStats();
            case "help", "?" -> showHelp();
            default -> {
                error("Unknown subcommand: " + subCommand);
                yield showHelp();
            }
        };
    }

    private CommandResult showHelp() {
        header("Supervisor Commands");
        helpLine("list [state]", "List servers");
        helpLine("info <server>", "Show server details");
        helpLine("create <name> <jar> [--kind=K] [--port=N]", "Provision a server");
        helpLine("start|stop|restart|kill <server>", "Control a server");
        helpLine("delete <server> [--purge]", "Remove a server");
        helpLine("send <server> <command...>", "Send console input");
        helpLine("logs <server> [--tail=N]", "View server output");
        helpLine("players <server>", "List connected players");
        helpLine("stats", "Show statistics");
        out.println(SEPARATOR);
        return CommandResult.ok();
    }

    private void helpLine(String usage, String description) {
        out.println("  " + usage + " - " + description);
    }

    // ==================== List ====================

    private CommandResult listServers(String[] args) {
        ServerState filter = null;
        if (args.length > 0 && !args[0].equalsIgnoreCase("all")) {
            filter = parseState(args[0]);
            if (filter == null) {
                error("Invalid filter. Use: stopped, starting, running, stopping, crashed or all");
                return CommandResult.failure("Invalid filter");
            }
        }

        Map<String, StatusSnapshot> statuses = supervisor.getAllStatuses();
        List<ServerDefinition> definitions = new ArrayList<>();
        for (ServerDefinition definition : supervisor.listDefinitions()) {
            StatusSnapshot status = statuses.get(definition.getId());
            if (status != null && (filter == null || status.state() == filter)) {
                definitions.add(definition);
            }
        }

        header("Servers" + (filter != null ? " (" + filter.getId() + ")" : ""));
        if (definitions.isEmpty()) {
            out.println("  No servers found.");
        } else {
            for (ServerDefinition definition : definitions) {
                StatusSnapshot status = statuses.get(definition.getId());
                out.printf("%s %s [%s] %s :%d (%d/%d)%n",
                        indicator(status.state()),
                        definition.getName(),
                        definition.getKind().getId(),
                        shortId(definition.getId()),
                        definition.getPort(),
                        status.connectedPlayers(),
                        definition.getMaxPlayers());
            }
        }
        out.println(SEPARATOR);
        out.println("  Total: " + definitions.size() + " server(s)");
        return CommandResult.ok();
    }

    private static String indicator(ServerState state) {
        return switch (state) {
            case RUNNING -> "●";
            case STARTING -> "◐";
            case STOPPING -> "◑";
            case STOPPED -> "○";
            case CRASHED -> "✖";
        };
    }

    // ==================== Info ====================

    private CommandResult showInfo(String[] args) {
        String serverId = requireServer(args, "info <server>");
        if (serverId == null) {
            return CommandResult.failure("Server not found");
        }

        ServerDefinition definition = supervisor.getDefinition(serverId);
        StatusSnapshot status = supervisor.getStatus(serverId);
        ResourceSnapshot resources = status.resources();

        header("Server: " + definition.getName());
        infoLine("Id", serverId);
        infoLine("Kind", definition.getKind().getId() + (definition.getVersion() != null ? " " + definition.getVersion() : ""));
        infoLine("Status", status.state().getId());
        infoLine("Port", String.valueOf(definition.getPort()));
        infoLine("Players", status.connectedPlayers() + "/" + definition.getMaxPlayers());
        infoLine("Memory", definition.getMinRamMb() + "M - " + definition.getMaxRamMb() + "M");
        infoLine("Directory", definition.getDirectory());
        infoLine("Auto start", definition.isAutoStart() ? "Yes" : "No");
        infoLine("Auto restart", definition.isAutoRestart() ? "Yes" : "No");
        if (status.pid() != null) {
            infoLine("PID", String.valueOf(status.pid()));
            infoLine("Uptime", formatDuration(status.uptimeSeconds()));
        }
        if (resources.sampledAt() != null) {
            infoLine("CPU", String.format(Locale.ROOT, "%.1f%%", resources.cpuPercent()));
            infoLine("RAM", resources.residentMemoryMegabytes() + " MB");
        }
        if (resources.hasTicksPerSecond()) {
            infoLine("TPS", String.format(Locale.ROOT, "%.1f", resources.ticksPerSecond()));
        }
        if (status.crashRestartAttempts() > 0) {
            infoLine("Crash restarts", String.valueOf(status.crashRestartAttempts()));
        }
        out.println(SEPARATOR);
        return CommandResult.ok();
    }

    private void infoLine(String key, String value) {
        out.println("  " + key + ": " + value);
    }

    static String formatDuration(long seconds) {
        if (seconds < 60) {
            return seconds + "s";
        } else if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        } else {
            return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
        }
    }

    // ==================== Create / Delete ====================

    private CommandResult createServer(String[] args) {
        if (args.length < 2) {
            error("Usage: create <name> <jar> [--kind=K] [--version=V] [--port=N] [--max-players=N] "
                    + "[--min-ram=MB] [--max-ram=MB] [--auto-start] [--no-auto-restart]");
            return CommandResult.failure("Missing name or jar");
        }

        SupervisorAPI.CreateOptions.Builder builder = SupervisorAPI.CreateOptions.builder()
                .name(args[0])
                .jarFile(args[1]);
        try {
            for (int i = 2; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--kind=")) {
                    builder.kind(ServerKind.fromId(arg.substring(7)));
                } else if (arg.startsWith("--version=")) {
                    builder.version(arg.substring(10));
                } else if (arg.startsWith("--port=")) {
                    builder.port(Integer.parseInt(arg.substring(7)));
                } else if (arg.startsWith("--max-players=")) {
                    builder.maxPlayers(Integer.parseInt(arg.substring(14)));
                } else if (arg.startsWith("--min-ram=")) {
                    builder.minRamMb(Integer.parseInt(arg.substring(10)));
                } else if (arg.startsWith("--max-ram=")) {
                    builder.maxRamMb(Integer.parseInt(arg.substring(10)));
                } else if (arg.equals("--auto-start")) {
                    builder.autoStart(true);
                } else if (arg.equals("--no-auto-restart")) {
                    builder.autoRestart(false);
                } else {
                    error("Unknown option: " + arg);
                    return CommandResult.failure("Unknown option");
                }
            }
            ServerDefinition definition = supervisor.createServer(builder.build());
            success("Created server " + definition.getName() + " with id " + definition.getId());
            return CommandResult.ok();
        } catch (NumberFormatException e) {
            error("Invalid number: " + e.getMessage());
            return CommandResult.failure("Invalid number");
        } catch (IllegalArgumentException | IllegalStateException e) {
            error(e.getMessage());
            return CommandResult.failure(e.getMessage());
        } catch (IOException e) {
            error("Failed to create server: " + e.getMessage());
            return CommandResult.failure("Create failed");
        }
    }

    private CommandResult deleteServer(String[] args) {
        String serverId = requireServer(args, "delete <server> [--purge]");
        if (serverId == null) {
            return CommandResult.failure("Server not found");
        }
        boolean purge = args.length > 1 && args[1].equalsIgnoreCase("--purge");

        progress("Deleting server " + serverId + (purge ? " and its files" : "") + "...");
        return track(supervisor.deleteServer(serverId, purge), value -> "Server " + serverId + " deleted.", "Failed to delete");
    }

    // ==================== Lifecycle ====================

    private CommandResult lifecycle(String[] args, String operation) {
        String serverId = requireServer(args, operation + " <server>");
        if (serverId == null) {
            return CommandResult.failure("Server not found");
        }

        CompletableFuture<?> future = switch (operation) {
            case "start" -> supervisor.startServer(serverId);
            case "stop" -> supervisor.stopServer(serverId);
            case "restart" -> supervisor.restartServer(serverId);
            case "kill" -> supervisor.killServer(serverId);
            default -> throw new IllegalArgumentException("Unknown operation: " + operation);
        };

        progress(capitalize(operation) + " requested for " + serverId + "...");
        return track(future, value -> "Server " + serverId + " is now "
                + (value instanceof ServerState state ? state : ServerState.STOPPED).getId() + ".", "Failed to " + operation);
    }

    private CommandResult track(CompletableFuture<?> future, Function<Object, String> successMessage,
                                String failurePrefix) {
        CompletableFuture<Void> completion = future.handle((value, error) -> {
            if (error != null) {
                error(failurePrefix + ": " + ServerSupervisor.unwrap(error).getMessage());
            } else {
                success(successMessage.apply(value));
            }
            return null;
        });
        return CommandResult.pending(completion);
    }

    // ==================== Console ====================

    private CommandResult sendCommand(String[] args) {
        if (args.length < 2) {
            error("Usage: send <server> <command...>");
            return CommandResult.failure("Missing command");
        }
        String serverId = requireServer(args, "send <server> <command...>");
        if (serverId == null) {
            return CommandResult.failure("Server not found");
        }

        String command = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
        try {
            supervisor.sendCommand(serverId, command);
        } catch (SupervisorException e) {
            error(e.getMessage());
            return CommandResult.failure(e.getMessage());
        }
        success("Sent to " + serverId + ": " + command);
        return CommandResult.ok();
    }

    private CommandResult showLogs(String[] args) {
        String serverId = requireServer(args, "logs <server> [--tail=N]");
        if (serverId == null) {
            return CommandResult.failure("Server not found");
        }

        int lines = DEFAULT_TAIL;
        for (int i = 1; i < args.length; i++) {
            if (args[i].startsWith("--tail=")) {
                try {
                    lines = Integer.parseInt(args[i].substring(7));
                } catch (NumberFormatException e) {
                    error("Invalid tail value: " + args[i].substring(7));
                    return CommandResult.failure("Invalid tail");
                }
            }
        }

        List<String> logs = supervisor.tailLogs(serverId, lines);
        header("Logs: " + serverId + " (last " + logs.size() + ")");
        if (logs.isEmpty()) {
            out.println("  No output captured.");
        }
        for (String line : logs) {
            out.println(line);
        }
        out.println(SEPARATOR);
        return CommandResult.ok();
    }

    private CommandResult showPlayers(String[] args) {
        String serverId = requireServer(args, "players <server>");
        if (serverId == null) {
            return CommandResult.failure("Server not found");
        }

        StatusSnapshot status = supervisor.getStatus(serverId);
        header("Players: " + serverId + " (" + status.connectedPlayers() + ")");
        if (status.players().isEmpty()) {
            out.println("  No players online.");
        }
        for (String player : status.players()) {
            out.println("  - " + player);
        }
        out.println(SEPARATOR);
        return CommandResult.ok();
    }

    // ==================== Stats ====================

    private CommandResult showStats() {
        ServerRegistry.RegistryStats stats = supervisor.getRegistry().getStats();
        header("Supervisor Statistics");
        infoLine("Servers", String.valueOf(stats.totalServers()));
        infoLine("Active", String.valueOf(stats.activeServers()));
        infoLine("Crashed", String.valueOf(stats.crashedServers()));
        infoLine("Players", String.valueOf(stats.totalPlayers()));
        out.println(SEPARATOR);
        return CommandResult.ok();
    }

    // ==================== Helpers ====================

    @Nullable
    private String requireServer(String[] args, String usage) {
        if (args.length == 0) {
            error("Usage: " + usage);
            return null;
        }
        String serverId = resolveServerId(args[0]);
        if (serverId == null) {
            error("Server not found: " + args[0]);
        }
        return serverId;
    }

    /**
     * Resolve an exact id, a unique id prefix or a unique display name.
     */
    @Nullable
    String resolveServerId(@Nonnull String reference) {
        if (supervisor.getRegistry().hasServer(reference)) {
            return reference;
        }
        String match = null;
        for (ServerDefinition definition : supervisor.listDefinitions()) {
            if (definition.getId().startsWith(reference) || definition.getName().equalsIgnoreCase(reference)) {
                if (match != null) {
                    return null;
                }
                match = definition.getId();
            }
        }
        return match;
    }

    @Nullable
    private static ServerState parseState(String value) {
        for (ServerState state : ServerState.values()) {
            if (state.getId().equalsIgnoreCase(value)) {
                return state;
            }
        }
        return null;
    }

    private static String shortId(String serverId) {
        return serverId.length() > 8 ? serverId.substring(0, 8) : serverId;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private void header(String title) {
        out.println(SEPARATOR);
        out.println(">> " + title + " <<");
        out.println(SEPARATOR);
    }

    private void progress(String message) {
        out.println("[*] " + message);
    }

    private void success(String message) {
        out.println("[✓] " + message);
    }

    private void error(String message) {
        out.println("[X] " + message);
    }
}
