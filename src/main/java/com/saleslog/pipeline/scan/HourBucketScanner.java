package com.saleslog.pipeline.scan;

import com.saleslog.pipeline.exception.DiscoveryException;
import com.saleslog.pipeline.model.BucketId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds the hour-bucket directories directly under the input root. Entries whose name is not a
 * valid {@link BucketId} are filtered out, not reported.
 */
@Component
public class HourBucketScanner {

    private static final Logger log = LoggerFactory.getLogger(HourBucketScanner.class);

    public List<BucketId> scan(Path root) throws DiscoveryException {
        if (!Files.isDirectory(root)) {
            throw new DiscoveryException(root, "not a readable directory", null);
        }
        List<BucketId> buckets = new ArrayList<>();
        int ignored = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (BucketId.isValid(name) && Files.isDirectory(entry)) {
                    buckets.add(new BucketId(name));
                } else {
                    ignored++;
                }
            }
        } catch (IOException | SecurityException e) {
            throw new DiscoveryException(root, e.getMessage(), e);
        }
        Collections.sort(buckets);
        log.debug("Found {} bucket(s) under {} ({} other entries ignored)", buckets.size(), root, ignored);
        return buckets;
    }
}
