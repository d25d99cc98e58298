package ai.vmhost.netprov;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.net.HostAndPort;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

public class HttpNetworkProvisioningClient implements NetworkProvisioningClient {
    private static final Logger LOG = LogManager.getLogger(HttpNetworkProvisioningClient.class);

    private final URI endpoint;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpNetworkProvisioningClient(HostAndPort address, Duration connectTimeout, Duration requestTimeout,
                                         ObjectMapper objectMapper)
    {
        this.endpoint = URI.create("http://%s:%d/".formatted(address.getHost(),
            address.getPortOrDefault(NetworkProvisioning.DEFAULT_PORT)));
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    public URI endpoint() {
        return endpoint;
    }

    @Override
    public List<String> createDevices(String id, int count) throws ProvisioningException {
        if (count < 0) {
            throw new IllegalArgumentException("Device count must not be negative: " + count);
        }
        LOG.info("Request {} tap device(s) for {} from {}", count, id, endpoint);

        var response = send("POST", new CreateDevicesRequest(id, count));
        try {
            var devices = objectMapper.readValue(response, Devices.class).devices();
            if (devices.size() != count) {
                throw new ProvisioningException("helper returned %d device(s), %d requested"
                    .formatted(devices.size(), count), 200);
            }
            return devices;
        } catch (JsonProcessingException e) {
            throw new ProvisioningException("cannot decode helper response: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void deleteDevices(List<String> devices) throws ProvisioningException {
        if (devices.isEmpty()) {
            return;
        }
        LOG.info("Request deletion of tap devices {} from {}", devices, endpoint);
        send("DELETE", new Devices(devices));
    }

    private String send(String method, Object body) throws ProvisioningException {
        final String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProvisioningException("cannot encode request: " + e.getOriginalMessage(), e);
        }

        var request = HttpRequest.newBuilder(endpoint)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .method(method, HttpRequest.BodyPublishers.ofString(json))
            .build();

        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (ConnectException | HttpConnectTimeoutException e) {
            throw new HelperUnavailableException(endpoint, e);
        } catch (HttpTimeoutException e) {
            throw new ProvisioningException("network helper at %s did not answer in %s"
                .formatted(endpoint, requestTimeout), e);
        } catch (IOException e) {
            throw new ProvisioningException("request to network helper failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException("interrupted while waiting for network helper", e);
        }

        if (response.statusCode() / 100 != 2) {
            LOG.error("Network helper rejected {} request: {} {}", method, response.statusCode(), response.body());
            throw new ProvisioningException("network helper rejected request: " + response.body().strip(),
                response.statusCode());
        }
        return response.body();
    }
}
