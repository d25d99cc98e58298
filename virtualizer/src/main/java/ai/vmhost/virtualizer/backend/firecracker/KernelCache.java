package ai.vmhost.virtualizer.backend.firecracker;

import ai.vmhost.longrunning.Operation;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local store of firecracker guest kernels, filled from the kernel download site on first use.
 */
@Singleton
@Requires(property = "virtualizer.firecracker.enabled", value = "true")
public class KernelCache {
    private static final Logger LOG = LogManager.getLogger(KernelCache.class);
    private static final int PROGRESS_STEPS = 4;

    private final Path dir;
    private final String downloadUrl;
    private final HttpClient httpClient;
    private final ConcurrentHashMap<String, Object> downloads = new ConcurrentHashMap<>();

    public KernelCache(VirtualizerConfig.Firecracker config, @Named("VirtualizerHttpClient") HttpClient httpClient) {
        this.dir = Path.of(config.getKernelCache());
        this.downloadUrl = config.getKernelDownloadUrl().endsWith("/")
            ? config.getKernelDownloadUrl()
            : config.getKernelDownloadUrl() + "/";
        this.httpClient = httpClient;
    }

    public static String fileName(String kernel) {
        return "firecracker-" + kernel;
    }

    /**
     * @return path of the vmlinux for {@code kernel}, downloaded if it is not cached yet
     */
    public Path fetch(String kernel, Operation op) throws IOException, InterruptedException {
        if (kernel == null || kernel.isBlank()) {
            throw new IOException("machine configuration does not name a kernel");
        }
        var name = fileName(kernel);
        var target = dir.resolve(name);

        op.updateStatus("Fetching vmlinux, searching %s for %s".formatted(dir, name));
        synchronized (downloads.computeIfAbsent(name, k -> new Object())) {
            if (Files.exists(target)) {
                return target;
            }
            download(name, target, op);
            return target;
        }
    }

    private void download(String name, Path target, Operation op) throws IOException, InterruptedException {
        op.updateStatus("Vmlinux for kernel doesn't exist, downloading...");
        Files.createDirectories(dir);

        var request = HttpRequest.newBuilder(URI.create(downloadUrl + name)).GET().build();
        var response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() == 404) {
            response.body().close();
            throw new IOException("kernel vmlinux '%s' does not exist".formatted(name));
        }
        if (response.statusCode() / 100 != 2) {
            response.body().close();
            throw new IOException("cannot download %s: HTTP %d".formatted(name, response.statusCode()));
        }

        long total = response.headers().firstValueAsLong("content-length").orElse(-1);
        var tmp = Files.createTempFile(dir, name, ".part");
        try (var in = response.body(); var out = Files.newOutputStream(tmp)) {
            var buf = new byte[64 * 1024];
            long downloaded = 0;
            long nextReport = total > 0 ? total / PROGRESS_STEPS : Long.MAX_VALUE;
            int n;
            while ((n = in.read(buf)) >= 0) {
                out.write(buf, 0, n);
                downloaded += n;
                if (downloaded >= nextReport) {
                    op.log("Downloading vmlinux (%s/%s)", bytes(downloaded), bytes(total));
                    nextReport += total / PROGRESS_STEPS;
                }
            }
            out.flush();
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            LOG.info("Downloaded {} ({} bytes) to {}", name, downloaded, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static String bytes(long count) {
        if (count < 1000) {
            return count + " B";
        }
        int exp = (int) (Math.log(count) / Math.log(1000));
        return String.format(Locale.ROOT, "%.1f %sB", count / Math.pow(1000, exp), "kMGTPE".charAt(exp - 1));
    }
}
