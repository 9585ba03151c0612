package com.hrx.core;

import com.hrx.core.config.HrxConfig;
import com.hrx.core.error.HrxContentException;
import com.hrx.core.error.HrxInputTooLargeException;
import com.hrx.core.model.BoundaryLength;
import com.hrx.core.model.HrxArchive;
import com.hrx.core.parser.HrxParser;
import com.hrx.core.serializer.HrxSerializer;
import com.hrx.core.validation.ContentValidator;
import com.hrx.core.validation.ContentViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Configured entry point for reading and writing archives.
 *
 * <p>Wraps the parser and serializer with the policies from {@link HrxConfig}: an input size
 * limit, the boundary length of new archives, and optional boundary widening on write.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * HrxCodec codec = new HrxCodec(ConfigLoader.load(Paths.get("hrx.yaml")));
 *
 * HrxArchive archive = codec.read(text);
 * archive.entries().put(HrxPath.parse("notes.txt"), HrxEntry.file("<===>\ninside"));
 * String out = codec.writeToString(archive);   // widens the boundary if autoResizeBoundary is set
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class HrxCodec {

    private static final Logger log = LoggerFactory.getLogger(HrxCodec.class);

    private final HrxConfig config;

    public HrxCodec() {
        this(HrxConfig.defaults());
    }

    public HrxCodec(HrxConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null").withDefaults();
        // fail fast on an unusable default
        BoundaryLength.of(this.config.defaultBoundaryLength());
    }

    public HrxConfig getConfig() {
        return config;
    }

    /**
     * Parses archive text after checking it against the configured size limit.
     *
     * @param text complete archive text
     * @return parsed archive
     * @throws HrxInputTooLargeException if the text exceeds {@code maxInputLength}
     * @throws com.hrx.core.error.HrxException for any parse failure
     */
    public HrxArchive read(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (config.hasInputLimit() && text.length() > config.maxInputLength()) {
            log.warn("Rejecting archive of {} characters (limit {})", text.length(), config.maxInputLength());
            throw new HrxInputTooLargeException(text.length(), config.maxInputLength());
        }
        return HrxParser.parse(text);
    }

    /**
     * Creates an empty archive using the configured boundary length.
     *
     * @return empty archive
     */
    public HrxArchive newArchive() {
        return HrxArchive.empty(config.defaultBoundaryLength());
    }

    /**
     * Writes an archive, widening its boundary first if allowed and needed.
     *
     * @param archive archive to write; its boundary length may change
     * @param sink destination
     * @throws HrxContentException if content validation fails and resizing is disabled
     * @throws IOException if the sink fails
     */
    public void write(HrxArchive archive, Appendable sink) throws IOException {
        prepare(archive);
        HrxSerializer.serialize(archive, sink);
    }

    public String writeToString(HrxArchive archive) {
        prepare(archive);
        return HrxSerializer.serializeToString(archive);
    }

    private void prepare(HrxArchive archive) {
        Objects.requireNonNull(archive, "archive must not be null");
        if (!config.autoResizeBoundary()) {
            return;
        }
        Optional<ContentViolation> violation = ContentValidator.check(archive, archive.getBoundary());
        if (violation.isPresent()) {
            BoundaryLength safe = ContentValidator.smallestSafeBoundaryLength(archive, archive.getBoundary());
            log.info("Boundary found in {}; widening boundary from {} to {}",
                violation.get().describe(), archive.boundaryLength(), safe.value());
            archive.setBoundaryLength(safe.value());
        }
    }
}
