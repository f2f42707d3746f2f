package de.mirkosertic.hgstatus.watcher;

import java.nio.file.Path;

@FunctionalInterface
public interface ChangeSourceFactory {

    ChangeSource create(Path root);
}
