package ai.vmhost.virtualizer.backend;

import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;
import ai.vmhost.virtualizer.util.HostExecutables;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Common part of the backends: settings are a JSON document mapped onto {@code S}, availability means the
 * hypervisor executable can be found.
 */
public abstract class AbstractBackend<S> implements Backend {
    private final Class<S> settingsType;
    private final HandleFactory handleFactory;
    protected final ObjectMapper mapper;

    protected AbstractBackend(Class<S> settingsType, HandleFactory handleFactory, ObjectMapper mapper) {
        this.settingsType = settingsType;
        this.handleFactory = handleFactory;
        this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    protected abstract String executable();

    protected abstract MachineDriver newDriver();

    /**
     * Backend-specific checks of parsed settings.
     */
    protected void validate(S settings) throws InvalidConfigurationException {
    }

    public S parseSettings(byte[] config) throws InvalidConfigurationException {
        if (config == null || config.length == 0) {
            throw new InvalidConfigurationException("empty %s configuration".formatted(identity()));
        }
        try {
            var settings = mapper.readValue(config, settingsType);
            if (settings == null) {
                throw new InvalidConfigurationException("empty %s configuration".formatted(identity()));
            }
            return settings;
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException(
                "invalid %s configuration: %s".formatted(identity(), e.getOriginalMessage()), e);
        } catch (IOException e) {
            throw new InvalidConfigurationException(
                "cannot read %s configuration: %s".formatted(identity(), e.getMessage()), e);
        }
    }

    @Override
    public void validateConfig(byte[] config) throws InvalidConfigurationException {
        validate(parseSettings(config));
    }

    @Override
    public boolean isAvailable() {
        return HostExecutables.find(executable()).isPresent();
    }

    @Override
    public VmHandle allocate(String virtualizer) {
        return handleFactory.create(identity(), virtualizer, newDriver());
    }
}
