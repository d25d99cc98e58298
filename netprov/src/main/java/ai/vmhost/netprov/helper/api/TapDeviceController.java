package ai.vmhost.netprov.helper.api;

import ai.vmhost.netprov.CreateDevicesRequest;
import ai.vmhost.netprov.Devices;
import ai.vmhost.netprov.helper.service.NetworkDeviceException;
import ai.vmhost.netprov.helper.service.TapDeviceService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Patch;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Put;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loopback endpoint of the tap device provisioning protocol.
 *
 * <ul>
 *     <li>{@code POST /} with {@code {"id": ..., "count": N}} answers {@code {"devices": ["id-0", ...]}}</li>
 *     <li>{@code DELETE /} with {@code {"devices": [...]}} answers 200 even for devices that are already gone</li>
 *     <li>any other method is answered with 400</li>
 * </ul>
 */
@Controller(value = "/", consumes = MediaType.ALL, produces = MediaType.APPLICATION_JSON)
public class TapDeviceController {
    private static final Logger LOG = LogManager.getLogger(TapDeviceController.class);

    static final String METHOD_NOT_AVAILABLE = "method not available";

    private final TapDeviceService service;
    private final ObjectMapper objectMapper;

    @Inject
    public TapDeviceController(TapDeviceService service, ObjectMapper objectMapper) {
        this.service = service;
        this.objectMapper = objectMapper;
    }

    @Post
    public MutableHttpResponse<String> create(@Nullable @Body String body) {
        final CreateDevicesRequest request;
        try {
            request = objectMapper.readValue(body == null ? "" : body, CreateDevicesRequest.class);
        } catch (JsonProcessingException e) {
            return badRequest(e.getOriginalMessage());
        }

        LOG.info("Create {} tap device(s) for {}", request.count(), request.id());
        try {
            var devices = service.createDevices(request.id(), request.count());
            return HttpResponse.ok(objectMapper.writeValueAsString(new Devices(devices)))
                .contentType(MediaType.APPLICATION_JSON_TYPE);
        } catch (NetworkDeviceException e) {
            return badRequest(e.getMessage());
        } catch (JsonProcessingException e) {
            LOG.error("Cannot encode response: {}", e.getMessage(), e);
            return HttpResponse.<String>serverError(e.getOriginalMessage()).contentType(MediaType.TEXT_PLAIN_TYPE);
        }
    }

    @Delete
    public MutableHttpResponse<String> delete(@Nullable @Body String body) {
        final Devices request;
        try {
            request = objectMapper.readValue(body == null ? "" : body, Devices.class);
        } catch (JsonProcessingException e) {
            return badRequest(e.getOriginalMessage());
        }

        LOG.info("Delete tap devices {}", request.devices());
        try {
            service.deleteDevices(request.devices());
            return HttpResponse.ok();
        } catch (NetworkDeviceException e) {
            return badRequest(e.getMessage());
        }
    }

    @Get
    public MutableHttpResponse<String> get() {
        return badRequest(METHOD_NOT_AVAILABLE);
    }

    @Put
    public MutableHttpResponse<String> put() {
        return badRequest(METHOD_NOT_AVAILABLE);
    }

    @Patch
    public MutableHttpResponse<String> patch() {
        return badRequest(METHOD_NOT_AVAILABLE);
    }

    private static MutableHttpResponse<String> badRequest(String message) {
        LOG.warn("Bad request: {}", message);
        return HttpResponse.<String>badRequest(message).contentType(MediaType.TEXT_PLAIN_TYPE);
    }
}
