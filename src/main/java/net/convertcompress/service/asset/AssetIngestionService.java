package net.convertcompress.service.asset;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.codec.ImageCodec;
import net.convertcompress.exception.ImageProcessingException;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.model.image.PixelSize;
import net.convertcompress.service.format.FormatCapabilityResolver;
import net.convertcompress.support.sandbox.SandboxAccessManager;
import net.convertcompress.util.LoggingUtils;
import net.convertcompress.util.PathUtils;
import org.springframework.stereotype.Service;

/**
 * Expands user-supplied files and folders into {@link ImageAsset}s.
 *
 * <p>Directories are walked recursively, skipping hidden entries. Only files whose
 * extension maps to a readable format are kept. Baseline pixel size and file size are
 * captured once here and never change afterwards.</p>
 */
@Slf4j
@Service
public class AssetIngestionService {

    private final AssetLibrary library;
    private final FormatCapabilityResolver formats;
    private final ImageCodec codec;
    private final SandboxAccessManager access;

    public AssetIngestionService(AssetLibrary library, FormatCapabilityResolver formats,
                                 ImageCodec codec, SandboxAccessManager access) {
        this.library = library;
        this.formats = formats;
        this.codec = codec;
        this.access = access;
    }

    /**
     * Ingests files and directories, adding new assets to the library.
     *
     * @return the assets added, in discovery order
     */
    public List<ImageAsset> ingest(Collection<Path> inputs) {
        Set<Path> candidates = new LinkedHashSet<>();
        for (Path input : inputs) {
            access.register(input);
            if (Files.isDirectory(input)) {
                candidates.addAll(enumerateDirectory(input));
            } else if (isReadableImage(input)) {
                candidates.add(input.toAbsolutePath().normalize());
            } else {
                log.debug("Skipping unsupported input {}", input);
            }
        }
        List<ImageAsset> created = new ArrayList<>();
        for (Path candidate : candidates) {
            if (!library.containsPath(candidate)) {
                created.add(ImageAsset.ingested(candidate, probePixelSize(candidate), probeFileSize(candidate)));
            }
        }
        List<ImageAsset> added = library.add(created);
        log.info("Ingested {} new assets from {} inputs", added.size(), inputs.size());
        return added;
    }

    /** Readable images beneath {@code root}, hidden files and folders excluded. */
    public List<Path> enumerateDirectory(Path root) {
        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && PathUtils.isHidden(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isReadableImage(file)) {
                        found.add(file.toAbsolutePath().normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LoggingUtils.warn(log, exc, "Skipping unreadable entry {}", file);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Failed to enumerate directory {}", root);
        }
        found.sort(null);
        return found;
    }

    private boolean isReadableImage(Path file) {
        if (PathUtils.isHidden(file) || !Files.isRegularFile(file)) {
            return false;
        }
        Optional<ImageFormat> format = formats.formatForPath(file);
        return format.isPresent() && formats.supportsReading(format.get());
    }

    private PixelSize probePixelSize(Path file) {
        try {
            return codec.readPixelSize(file);
        } catch (ImageProcessingException e) {
            log.debug("Could not read pixel size of {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static Long probeFileSize(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("Could not read file size of {}: {}", file, e.getMessage());
            return null;
        }
    }
}
