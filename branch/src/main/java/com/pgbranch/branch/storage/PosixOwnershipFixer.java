package com.pgbranch.branch.storage;

import com.pgbranch.branch.exception.CloneException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.GroupPrincipal;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.UserPrincipal;
import java.nio.file.attribute.UserPrincipalLookupService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Sets owner and group of every file under a cloned directory to {@code pgbranch.clone.owner}.
 */
@Slf4j
@Component
public class PosixOwnershipFixer implements OwnershipFixer {

    private final String owner;
    private final String group;

    public PosixOwnershipFixer(@Value("${pgbranch.clone.owner:postgres}") String owner,
                               @Value("${pgbranch.clone.group:}") String group) {
        this.owner = owner;
        this.group = group.isBlank() ? owner : group;
    }

    @Override
    public void fixOwnership(Path path) {
        UserPrincipal user;
        GroupPrincipal groupPrincipal;
        UserPrincipalLookupService lookup = FileSystems.getDefault().getUserPrincipalLookupService();
        try {
            user = lookup.lookupPrincipalByName(owner);
            groupPrincipal = lookup.lookupPrincipalByGroupName(group);
        } catch (IOException e) {
            throw new CloneException(path.toString(), "Unknown owner " + owner + ":" + group, e);
        }

        AtomicInteger changed = new AtomicInteger();
        try (Stream<Path> paths = Files.walk(path)) {
            paths.forEach(p -> {
                PosixFileAttributeView view = Files.getFileAttributeView(
                        p, PosixFileAttributeView.class, LinkOption.NOFOLLOW_LINKS);
                if (view == null) {
                    throw new CloneException(path.toString(), "File system does not support POSIX ownership");
                }
                try {
                    view.setOwner(user);
                    view.setGroup(groupPrincipal);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                changed.incrementAndGet();
            });
        } catch (IOException | UncheckedIOException e) {
            throw new CloneException(path.toString(), "Cannot change ownership to " + owner + ":" + group, e);
        }

        log.info("Ownership fixed: path={}, owner={}, group={}, files={}", path, owner, group, changed.get());
    }
}
