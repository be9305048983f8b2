package com.cusip.refdata.load.source;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.cusip.refdata.load.error.AmbiguousSourceException;
import com.cusip.refdata.load.error.SourceUnavailableException;
import com.cusip.refdata.load.model.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Object-store variant: lists keys under {@code prefix + template head} and matches the last path
 * segment of each key against the file name template. The matched object is buffered once so the
 * returned file can be re-read.
 */
public class S3FileSource implements FileSource {
    private static final Logger log = LoggerFactory.getLogger(S3FileSource.class);

    private final AmazonS3 s3Client;
    private final String bucket;
    private final String prefix;
    private final FileNameTemplate template;

    public S3FileSource(AmazonS3 s3Client, String bucket, String prefix, FileNameTemplate template) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("S3 bucket is required for the s3 file source");
        }
        this.s3Client = s3Client;
        this.bucket = bucket.trim();
        this.prefix = prefix == null ? "" : prefix;
        this.template = template;
    }

    @Override
    public Optional<SourceFile> fetch(RecordType recordType, LocalDate date) {
        Pattern pattern = template.patternFor(recordType, date);
        String searchPrefix = prefix + template.literalPrefix(date);
        List<String> matches = new ArrayList<>();
        try {
            ListObjectsV2Request request = new ListObjectsV2Request()
                .withBucketName(bucket)
                .withPrefix(searchPrefix);
            ListObjectsV2Result result;
            do {
                result = s3Client.listObjectsV2(request);
                for (S3ObjectSummary summary : result.getObjectSummaries()) {
                    String key = summary.getKey();
                    if (pattern.matcher(fileName(key)).matches()) {
                        matches.add(key);
                    }
                }
                request.setContinuationToken(result.getNextContinuationToken());
            } while (result.isTruncated());
        } catch (AmazonClientException e) {
            throw new SourceUnavailableException(
                "Failed to list s3://" + bucket + "/" + searchPrefix + ": " + e.getMessage(),
                e
            );
        }

        if (matches.isEmpty()) {
            log.debug("No {} object under s3://{}/{}", recordType.apiName(), bucket, searchPrefix);
            return Optional.empty();
        }
        if (matches.size() > 1) {
            throw new AmbiguousSourceException(template.describe(recordType, date), matches);
        }

        String key = matches.get(0);
        String location = "s3://" + bucket + "/" + key;
        return Optional.of(SourceFile.ofBytes(fileName(key), location, download(key, location)));
    }

    @Override
    public String describe() {
        return "s3://" + bucket + "/" + prefix;
    }

    private byte[] download(String key, String location) {
        try (S3Object object = s3Client.getObject(bucket, key);
             InputStream content = object.getObjectContent()) {
            return content.readAllBytes();
        } catch (AmazonClientException | IOException e) {
            throw new SourceUnavailableException("Failed to read " + location + ": " + e.getMessage(), e);
        }
    }

    private static String fileName(String key) {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }
}
