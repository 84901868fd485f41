package net.convertcompress.application.destination;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.CopyOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.exception.ImageExportException;
import net.convertcompress.model.DestinationPlan;
import net.convertcompress.support.sandbox.ScopedAccessToken;
import net.convertcompress.support.sandbox.SandboxAccessManager;
import net.convertcompress.util.LoggingUtils;
import net.convertcompress.util.PathUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Writes encoded bytes so the destination is never observed half-written: the bytes go
 * to a uniquely named scratch file in the destination directory, which is then renamed
 * over the target (replace when it exists, move otherwise). The scratch file is removed
 * on any failure.
 */
@Slf4j
@Component
public class AtomicFileCommitter {

    private final SandboxAccessManager access;
    private final CommitListener listener;

    @Autowired
    public AtomicFileCommitter(SandboxAccessManager access) {
        this(access, CommitListener.NONE);
    }

    public AtomicFileCommitter(SandboxAccessManager access, CommitListener listener) {
        this.access = access;
        this.listener = listener == null ? CommitListener.NONE : listener;
    }

    /**
     * Commits {@code data} to {@code plan.path()}.
     *
     * @return the committed destination
     * @throws ImageExportException when the write or the final move fails
     * @throws net.convertcompress.exception.PermissionDeniedException when the directory is not accessible
     */
    public Path commit(byte[] data, DestinationPlan plan) {
        Path directory = plan.directory();
        Path destination = plan.path();
        try (ScopedAccessToken ignored = access.acquire(directory)) {
            createDirectory(directory);
            Path temp = PathUtils.temporarySibling(directory, plan.filenameStem(), plan.extension());
            try {
                writeDurably(temp, data);
                listener.onTempWritten(temp, destination);
                moveIntoPlace(temp, destination);
                log.debug("Committed {} bytes to {}", data.length, destination);
                return destination;
            } catch (IOException e) {
                discard(temp);
                throw new ImageExportException(destination, e.getMessage(), e);
            } catch (RuntimeException e) {
                discard(temp);
                throw new ImageExportException(destination, "commit interrupted: " + e.getMessage(), e);
            }
        }
    }

    private static void createDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ImageExportException(directory, "cannot create destination directory", e);
        }
    }

    private static void writeDurably(Path temp, byte[] data) throws IOException {
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void moveIntoPlace(Path temp, Path destination) throws IOException {
        boolean replace = Files.exists(destination);
        CopyOption[] atomic = replace
            ? new CopyOption[] {StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING}
            : new CopyOption[] {StandardCopyOption.ATOMIC_MOVE};
        try {
            Files.move(temp, destination, atomic);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to a plain move", destination);
            CopyOption[] plain = replace
                ? new CopyOption[] {StandardCopyOption.REPLACE_EXISTING}
                : new CopyOption[0];
            Files.move(temp, destination, plain);
        }
    }

    private static void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Could not remove scratch file {}", temp);
        }
    }
}
