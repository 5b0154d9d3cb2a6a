package dev.fumaz.bracket.io;

import dev.fumaz.bracket.Bracket;
import dev.fumaz.bracket.function.Use;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.attribute.FileAttribute;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Brackets over files: the file is opened, handed to the callback and closed exactly once afterwards.
 */
public final class FileBrackets {

    private FileBrackets() {
    }

    /**
     * Opens {@code path} for reading.
     */
    public static <T> @Nullable T withOpen(@NotNull Path path,
                                           @NotNull Use<? super InputStream, T, IOException> use) throws IOException {
        Objects.requireNonNull(path, "path");

        return Bracket.<InputStream, T, IOException>bracket(() -> Files.newInputStream(path), InputStream::close, use);
    }

    /**
     * Creates {@code path} for writing, truncating it if it already exists.
     */
    public static <T> @Nullable T withCreate(@NotNull Path path,
                                             @NotNull Use<? super OutputStream, T, IOException> use) throws IOException {
        Objects.requireNonNull(path, "path");

        return Bracket.<OutputStream, T, IOException>bracket(() -> Files.newOutputStream(path), OutputStream::close, use);
    }

    /**
     * Opens a channel to {@code path} with the given options. The attributes, such as POSIX permissions, apply when
     * the file is created.
     */
    public static <T> @Nullable T withOpenFile(@NotNull Path path,
                                               @NotNull Set<? extends OpenOption> options,
                                               @NotNull Use<? super FileChannel, T, IOException> use,
                                               @NotNull FileAttribute<?>... attributes) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(attributes, "attributes");

        return Bracket.<FileChannel, T, IOException>bracket(() -> FileChannel.open(path, options, attributes),
                FileChannel::close, use);
    }

    public static <T> @Nullable T withOpenFile(@NotNull Path path,
                                               @NotNull Use<? super FileChannel, T, IOException> use,
                                               @NotNull OpenOption... options) throws IOException {
        Objects.requireNonNull(options, "options");

        return withOpenFile(path, new LinkedHashSet<>(Arrays.asList(options)), use);
    }
}
