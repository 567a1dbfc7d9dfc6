package net.lavalauncher.launcher.downloads;

import org.jetbrains.annotations.Nullable;

import java.net.URI;

record SimpleDownloadSpec(URI uri, @Nullable String checksum) implements DownloadSpec {
}
