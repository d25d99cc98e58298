package ai.vmhost.virtualizer.net;

import ai.vmhost.virtualizer.console.Subscription;
import ai.vmhost.virtualizer.model.RouteTable;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.net.InetAddresses;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Watches the console of a booting guest for the addresses it obtained over DHCP and writes them into the
 * route table. Interface {@code i} gets the {@code i}-th reported address.
 */
public final class IpLookout implements Runnable {
    private static final Logger LOG = LogManager.getLogger(IpLookout.class);

    private static final Pattern IPV4 = Pattern.compile("(?<![\\d.])(\\d{1,3}(?:\\.\\d{1,3}){3})(?![\\d.])");
    private static final Duration SETTLE_TIME = Duration.ofSeconds(1);

    private final String vmName;
    private final Subscription console;
    private final RouteTable routes;
    private final Duration timeout;
    private volatile String consoleText = "";

    public IpLookout(String vmName, Subscription console, RouteTable routes, Duration timeout) {
        this.vmName = vmName;
        this.console = console;
        this.routes = routes;
        this.timeout = timeout;
    }

    @Override
    public void run() {
        var output = new ByteArrayOutputStream();
        var deadline = Instant.now().plus(timeout);
        Instant settleAt = null;

        try {
            while (true) {
                var limit = settleAt != null && settleAt.isBefore(deadline) ? settleAt : deadline;
                var remaining = Duration.between(Instant.now(), limit);
                if (remaining.isNegative() || remaining.isZero()) {
                    break;
                }

                var chunk = console.poll(remaining);
                if (chunk == null) {
                    if (console.isEnded()) {
                        break;
                    }
                    continue;
                }

                // decoded as a whole, a multibyte character may be split between chunks
                output.write(chunk, 0, chunk.length);
                // keep reading a little longer, other interfaces usually report right after the first one
                if (settleAt == null && !extractAddresses(output.toString(StandardCharsets.UTF_8)).isEmpty()) {
                    settleAt = Instant.now().plus(SETTLE_TIME);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Address lookup for {} interrupted", vmName);
        } finally {
            console.close();
        }

        consoleText = output.toString(StandardCharsets.UTF_8);
        var addresses = extractAddresses(consoleText);
        if (addresses.isEmpty()) {
            LOG.warn("Machine {} did not report its network address within {}", vmName, timeout);
            return;
        }
        routes.assignAddresses(addresses);
        LOG.info("Machine {} reported address(es) {}", vmName, addresses);
    }

    /**
     * @return console output seen by the last run
     */
    @VisibleForTesting
    String consoleText() {
        return consoleText;
    }

    /**
     * Finds the first IPv4 address of every line that mentions {@code ip}, in order of appearance.
     */
    @VisibleForTesting
    static List<String> extractAddresses(String text) {
        var found = new LinkedHashSet<String>();
        for (var line : text.split("\\r?\\n")) {
            if (!line.toLowerCase(Locale.ROOT).contains("ip")) {
                continue;
            }
            // one address per line, the first one is the interface's own
            var matcher = IPV4.matcher(line);
            while (matcher.find()) {
                var candidate = matcher.group(1);
                if (InetAddresses.isInetAddress(candidate)) {
                    found.add(candidate);
                    break;
                }
            }
        }
        return new ArrayList<>(found);
    }
}
