package net.convertcompress.support.sandbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.convertcompress.exception.PermissionDeniedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SandboxAccessManagerTest {

    @TempDir
    Path root;

    @Test
    void should_CountReentrantTokens_When_SamePathAcquiredTwice() {
        SandboxAccessManager manager = new SandboxAccessManager(false, List.of());
        Path file = root.resolve("a.png");

        ScopedAccessToken first = manager.acquire(file);
        ScopedAccessToken second = manager.acquire(file);
        assertThat(manager.activeTokenCount(file)).isEqualTo(2);

        first.close();
        first.close();
        assertThat(manager.activeTokenCount(file)).isEqualTo(1);
        assertThat(first.isReleased()).isTrue();

        second.close();
        assertThat(manager.totalActiveTokens()).isZero();
    }

    @Test
    void should_DenyAccess_When_EnforcedAndPathIsOutsideRoots() {
        SandboxAccessManager manager = new SandboxAccessManager(true, List.of(root.resolve("allowed")));

        assertThatThrownBy(() -> manager.acquire(root.resolve("other/b.png")))
            .isInstanceOf(PermissionDeniedException.class);
        assertThat(manager.canAccess(root.resolve("other"))).isFalse();
        assertThat(manager.canAccess(root.resolve("allowed/nested"))).isTrue();
        assertThat(manager.totalActiveTokens()).isZero();
    }

    @Test
    void should_GrantParentDirectory_When_FileIsRegistered() throws Exception {
        SandboxAccessManager manager = new SandboxAccessManager(true, List.of());
        Path picked = Files.writeString(Files.createDirectories(root.resolve("picked")).resolve("c.png"), "x");

        manager.register(picked);

        try (ScopedAccessToken token = manager.acquire(root.resolve("picked/sibling.png"))) {
            assertThat(token.path()).isEqualTo(root.resolve("picked/sibling.png").toAbsolutePath().normalize());
        }
        assertThat(manager.canAccess(root)).isFalse();
    }
}
