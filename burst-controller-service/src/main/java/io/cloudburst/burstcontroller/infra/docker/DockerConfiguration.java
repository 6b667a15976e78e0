package io.cloudburst.burstcontroller.infra.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import io.cloudburst.burst.ports.CloudBackend;
import io.cloudburst.burstcontroller.config.BurstControllerProperties;
import io.cloudburst.docker.DockerContainerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DockerConfiguration {
    private static final Logger log = LoggerFactory.getLogger(DockerConfiguration.class);

    @Bean
    public DockerClient dockerClient() {
        DefaultDockerClientConfig config = DefaultDockerClientConfig.createDefaultConfigBuilder().build();
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public DockerContainerClient dockerContainerClient(DockerClient dockerClient) {
        return new DockerContainerClient(dockerClient);
    }

    @Bean
    public CloudBackend cloudBackend(DockerContainerClient dockerContainerClient,
                                     BurstControllerProperties properties) {
        BurstControllerProperties.Docker docker = properties.getDocker();
        log.info("Burst VMs run as containers from image {} (name prefix '{}', network {})",
            docker.getImage(), docker.getNamePrefix(), docker.getNetwork() == null ? "auto" : docker.getNetwork());
        return new DockerCloudBackend(dockerContainerClient, docker);
    }
}
