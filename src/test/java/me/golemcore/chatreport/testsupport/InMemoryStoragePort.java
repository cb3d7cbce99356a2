package me.golemcore.chatreport.testsupport;

import me.golemcore.chatreport.domain.exception.StorageException;
import me.golemcore.chatreport.port.outbound.StoragePort;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed storage for domain tests. Writes can be made to fail.
 */
public class InMemoryStoragePort implements StoragePort {

    private final Map<String, String> files = new ConcurrentHashMap<>();
    private volatile boolean failWrites;
    private volatile boolean available = true;

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public String read(String directory, String path) {
        return files.get(key(directory, path));
    }

    public void write(String directory, String path, String content) {
        files.put(key(directory, path), content);
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.completedFuture(files.get(key(directory, path)));
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        String base = directory + "/";
        String start = prefix == null || prefix.isEmpty() ? base : base + prefix + "/";
        List<String> result = files.keySet().stream()
                .filter(k -> k.startsWith(start))
                .map(k -> k.substring(base.length()))
                .sorted()
                .toList();
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        if (failWrites) {
            return CompletableFuture.failedFuture(
                    new StorageException("Simulated write failure: " + directory + "/" + path, null));
        }
        files.put(key(directory, path), content);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    private static String key(String directory, String path) {
        return directory + "/" + path;
    }
}
