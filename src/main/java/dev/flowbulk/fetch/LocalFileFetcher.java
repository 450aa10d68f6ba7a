package dev.flowbulk.fetch;

import dev.flowbulk.model.FlowVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads workflow definitions from the local file system.
 * A name is looked up under the flows directory as {@code <name>.flow-meta.xml},
 * {@code <name>.flow}, {@code <name>.xml} and {@code <name>.json}, in that order.
 */
public final class LocalFileFetcher implements WorkflowFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(LocalFileFetcher.class);

    static final List<String> SUFFIXES = List.of(".flow-meta.xml", ".flow", ".xml", ".json");

    private final Path flowsDirectory;

    public LocalFileFetcher(Path flowsDirectory) {
        this.flowsDirectory = flowsDirectory;
    }

    @Override
    public RawMetadata fetch(String nameOrPath) throws WorkflowNotFoundException {
        Path file = locate(nameOrPath);
        if (file == null) {
            throw new WorkflowNotFoundException(nameOrPath,
                "Workflow '%s' not found in %s".formatted(nameOrPath, flowsDirectory));
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            var version = new FlowVersion("1", "Local", Files.getLastModifiedTime(file).toInstant().toString());
            LOG.debug("Read workflow {} from {}", nameOrPath, file);
            return new RawMetadata(workflowName(file), content, version);
        } catch (IOException e) {
            throw new WorkflowNotFoundException(nameOrPath, "Failed to read workflow from " + file, e);
        }
    }

    @Override
    public String describe() {
        return "local files under " + flowsDirectory;
    }

    private Path locate(String nameOrPath) {
        Path direct = asPath(nameOrPath);
        if (direct != null && Files.isRegularFile(direct)) {
            return direct;
        }
        for (String suffix : SUFFIXES) {
            Path candidate = asPath(nameOrPath + suffix);
            if (candidate != null && Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private Path asPath(String relative) {
        try {
            Path path = Path.of(relative);
            return path.isAbsolute() || Files.isRegularFile(path) ? path : flowsDirectory.resolve(relative);
        } catch (InvalidPathException e) {
            LOG.debug("Not a usable path: {}", relative);
            return null;
        }
    }

    /** Workflow name derived from a file name by dropping the first matching suffix. */
    static String workflowName(Path file) {
        String fileName = file.getFileName().toString();
        for (String suffix : SUFFIXES) {
            if (fileName.endsWith(suffix)) {
                return fileName.substring(0, fileName.length() - suffix.length());
            }
        }
        return fileName;
    }
}
