package me.internalizable.craftkeeper.supervisor.command;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of a console command.
 *
 * @param success whether the command was accepted
 * @param message failure reason, null on success
 * @param completion completes once any asynchronous work the command started has finished
 */
public record CommandResult(boolean success, @Nullable String message, @Nonnull CompletableFuture<Void> completion) {

    @Nonnull
    public static CommandResult ok() {
        return new CommandResult(true, null, CompletableFuture.completedFuture(null));
    }

    @Nonnull
    public static CommandResult pending(@Nonnull CompletableFuture<Void> completion) {
        return new CommandResult(true, null, completion);
    }

    @Nonnull
    public static CommandResult failure(@Nonnull String message) {
        return new CommandResult(false, message, CompletableFuture.completedFuture(null));
    }
}
