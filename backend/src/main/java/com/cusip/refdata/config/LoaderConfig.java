package com.cusip.refdata.config;

import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.cusip.refdata.load.source.FileNameTemplate;
import com.cusip.refdata.load.source.FileSource;
import com.cusip.refdata.load.source.LocalDirectoryFileSource;
import com.cusip.refdata.load.source.S3FileSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Locale;

@Configuration
public class LoaderConfig {
    private static final Logger log = LoggerFactory.getLogger(LoaderConfig.class);

    @Bean
    public FileNameTemplate fileNameTemplate(LoaderProperties properties) {
        return FileNameTemplate.parse(properties.getSource().getFileNameTemplate());
    }

    @Bean
    public FileSource fileSource(LoaderProperties properties, FileNameTemplate fileNameTemplate) {
        LoaderProperties.Source source = properties.getSource();
        String type = source.getType() == null ? "" : source.getType().trim().toLowerCase(Locale.ROOT);
        FileSource fileSource = switch (type) {
            case "local" -> new LocalDirectoryFileSource(Path.of(source.getDirectory()), fileNameTemplate);
            case "s3" -> new S3FileSource(
                amazonS3(source.getS3()),
                source.getS3().getBucket(),
                source.getS3().getPrefix(),
                fileNameTemplate
            );
            default -> throw new IllegalStateException("Unsupported loader.source.type: " + source.getType());
        };
        log.info("Reading PIP files from {} using template {}", fileSource.describe(), fileNameTemplate);
        return fileSource;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    static AmazonS3 amazonS3(LoaderProperties.S3 s3) {
        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
            .withCredentials(DefaultAWSCredentialsProviderChain.getInstance());
        String region = s3.getRegion();
        String endpoint = s3.getEndpoint();
        if (endpoint != null && !endpoint.isBlank()) {
            builder.withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(endpoint.trim(), region))
                .withPathStyleAccessEnabled(true);
        } else if (region != null && !region.isBlank()) {
            builder.withRegion(region.trim());
        }
        return builder.build();
    }
}
