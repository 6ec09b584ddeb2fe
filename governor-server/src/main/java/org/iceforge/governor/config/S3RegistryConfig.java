package org.iceforge.governor.config;

import org.iceforge.governor.registry.ArtifactRegistry;
import org.iceforge.governor.registry.s3.S3ArtifactRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * S3-backed artifact registry, active with {@code governor.registry.store=s3}.
 */
@Configuration
@ConditionalOnProperty(prefix = "governor.registry", name = "store", havingValue = "s3")
public class S3RegistryConfig {
    private static final Logger log = LoggerFactory.getLogger(S3RegistryConfig.class);

    @Bean(destroyMethod = "close")
    public S3Client artifactS3Client(RegistryProperties props) {
        RegistryProperties.S3 s3 = props.getS3();
        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .region(Region.of(s3.getRegion()))
                .serviceConfiguration(
                        S3Configuration.builder()
                                .pathStyleAccessEnabled(s3.isPathStyleAccess())
                                .build()
                );

        if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
            b = b.endpointOverride(URI.create(s3.getEndpoint()));
        }
        return b.build();
    }

    @Bean
    public ArtifactRegistry s3ArtifactRegistry(S3Client artifactS3Client, RegistryProperties props) {
        RegistryProperties.S3 s3 = props.getS3();
        log.info("Using S3 artifact registry at s3://{}/{}", s3.getBucket(), s3.getPrefix());
        return new S3ArtifactRegistry(artifactS3Client, s3.getBucket(), s3.getPrefix());
    }
}
