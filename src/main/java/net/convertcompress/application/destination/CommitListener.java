package net.convertcompress.application.destination;

import java.nio.file.Path;

/**
 * Hook invoked between writing the scratch file and moving it into place.
 */
@FunctionalInterface
public interface CommitListener {

    CommitListener NONE = (temp, destination) -> { };

    void onTempWritten(Path temp, Path destination);
}
