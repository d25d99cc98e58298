package ai.vmhost.virtualizer.backend.firecracker;

import ai.vmhost.virtualizer.console.ConsoleDialer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Minimal HTTP/1.1 client for the firecracker API socket.
 */
final class FirecrackerApi {
    private final ConsoleDialer dialer;
    private final Path socket;
    private final Duration timeout;

    FirecrackerApi(ConsoleDialer dialer, Path socket, Duration timeout) {
        this.dialer = dialer;
        this.socket = socket;
        this.timeout = timeout;
    }

    void sendCtrlAltDel() throws IOException, InterruptedException {
        put("/actions", "{\"action_type\":\"SendCtrlAltDel\"}");
    }

    private void put(String path, String json) throws IOException, InterruptedException {
        var body = json.getBytes(StandardCharsets.UTF_8);
        var request = ("PUT " + path + " HTTP/1.1\r\n"
            + "Host: localhost\r\n"
            + "Accept: application/json\r\n"
            + "Content-Type: application/json\r\n"
            + "Content-Length: " + body.length + "\r\n"
            + "Connection: close\r\n"
            + "\r\n").getBytes(StandardCharsets.US_ASCII);

        try (var conn = dialer.dial(socket, timeout)) {
            var out = conn.output();
            out.write(request);
            out.write(body);
            out.flush();

            var reader = new BufferedReader(new InputStreamReader(conn.input(), StandardCharsets.US_ASCII));
            var statusLine = reader.readLine();
            if (statusLine == null) {
                throw new IOException("firecracker closed the API connection without a response");
            }
            var parts = statusLine.split(" ", 3);
            if (parts.length < 2 || !parts[1].startsWith("2")) {
                throw new IOException("firecracker rejected %s %s: %s".formatted("PUT", path, statusLine));
            }
        }
    }
}
