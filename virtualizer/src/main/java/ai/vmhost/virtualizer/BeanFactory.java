package ai.vmhost.virtualizer;

import ai.vmhost.common.IdGenerator;
import ai.vmhost.common.RandomIdGenerator;
import ai.vmhost.longrunning.OperationsExecutor;
import ai.vmhost.netprov.HttpNetworkProvisioningClient;
import ai.vmhost.netprov.NetworkProvisioningClient;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.net.HostAndPort;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import java.net.http.HttpClient;

@Factory
public class BeanFactory {

    @Singleton
    public ObjectMapper mapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Bean(preDestroy = "shutdown")
    @Singleton
    @Named("VirtualizerOperationsExecutor")
    public OperationsExecutor operationsExecutor(VirtualizerConfig.Executor config) {
        return new OperationsExecutor(config.getCorePoolSize(), config.getMaxPoolSize());
    }

    @Singleton
    public IdGenerator idGenerator() {
        return new RandomIdGenerator();
    }

    @Singleton
    public NetworkProvisioningClient networkProvisioningClient(VirtualizerConfig.NetworkHelper config,
                                                               ObjectMapper mapper)
    {
        return new HttpNetworkProvisioningClient(HostAndPort.fromString(config.getAddress()),
            config.getConnectTimeout(), config.getRequestTimeout(), mapper);
    }

    @Singleton
    @Named("VirtualizerHttpClient")
    public HttpClient downloadClient(VirtualizerConfig.NetworkHelper config) {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(config.getConnectTimeout())
            .build();
    }
}
