package com.cusip.refdata.load.source;

import com.cusip.refdata.load.error.AmbiguousSourceException;
import com.cusip.refdata.load.error.SourceUnavailableException;
import com.cusip.refdata.load.model.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public class LocalDirectoryFileSource implements FileSource {
    private static final Logger log = LoggerFactory.getLogger(LocalDirectoryFileSource.class);

    private final Path directory;
    private final FileNameTemplate template;

    public LocalDirectoryFileSource(Path directory, FileNameTemplate template) {
        this.directory = directory;
        this.template = template;
    }

    @Override
    public Optional<SourceFile> fetch(RecordType recordType, LocalDate date) {
        if (!Files.isDirectory(directory)) {
            throw new SourceUnavailableException("Directory not found: " + directory);
        }
        Pattern pattern = template.patternFor(recordType, date);
        List<Path> matches;
        try (Stream<Path> entries = Files.list(directory)) {
            matches = entries
                .filter(Files::isRegularFile)
                .filter(path -> pattern.matcher(path.getFileName().toString()).matches())
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to list " + directory + ": " + e.getMessage(), e);
        }

        if (matches.isEmpty()) {
            log.debug("No {} file in {} matching {}", recordType.apiName(), directory, template.describe(recordType, date));
            return Optional.empty();
        }
        if (matches.size() > 1) {
            throw new AmbiguousSourceException(
                template.describe(recordType, date),
                matches.stream().map(path -> path.getFileName().toString()).toList()
            );
        }

        Path file = matches.get(0);
        if (!Files.isReadable(file)) {
            throw new SourceUnavailableException("File is not readable: " + file);
        }
        return Optional.of(new SourceFile(file.getFileName().toString(), file.toString(), () -> Files.newInputStream(file)));
    }

    @Override
    public String describe() {
        return "local:" + directory;
    }
}
