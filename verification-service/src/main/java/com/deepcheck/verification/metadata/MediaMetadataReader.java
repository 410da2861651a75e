package com.deepcheck.verification.metadata;

import com.deepcheck.common.exception.DecodeException;
import com.deepcheck.common.metadata.MediaMetadata;
import com.deepcheck.verification.video.VideoProbe;
import com.drew.imaging.FileType;
import com.drew.imaging.FileTypeDetector;
import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.jpeg.JpegDirectory;
import com.drew.metadata.png.PngDirectory;
import com.drew.metadata.xmp.XmpDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;

/**
 * Extracts {@link MediaMetadata} from uploads: EXIF, XMP and PNG text chunks for images
 * (metadata-extractor), container tags for videos (from the ffprobe result).
 *
 * <p>Never fails: a file whose metadata cannot be read is reported as carrying none.
 */
@Component
public class MediaMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(MediaMetadataReader.class);

    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");
    private static final String PNG_TEXT = "Textual Data";

    /**
     * Checks the file signature of an uploaded still image.
     *
     * @throws DecodeException when the bytes are neither JPEG nor PNG
     */
    public void requireDecodableImage(byte[] bytes) {
        FileType type;
        try {
            type = FileTypeDetector.detectFileType(new BufferedInputStream(new ByteArrayInputStream(bytes)));
        } catch (IOException e) {
            throw new DecodeException("image signature unreadable: " + e.getMessage(), e);
        }
        if (type != FileType.Jpeg && type != FileType.Png) {
            throw new DecodeException("not a JPEG or PNG image (detected " + type + ")");
        }
    }

    public MediaMetadata readImage(byte[] bytes) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(bytes), bytes.length);
        } catch (ImageProcessingException | IOException e) {
            log.debug("No readable metadata in image: {}", e.getMessage());
            return MediaMetadata.empty();
        } catch (RuntimeException e) {
            log.warn("Metadata parser rejected image: {}", e.toString());
            return MediaMetadata.empty();
        }

        ExifIFD0Directory ifd0     = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        ExifSubIFDDirectory subIfd = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        boolean capturePresent = (ifd0 != null && ifd0.getTagCount() > 0)
                              || (subIfd != null && subIfd.getTagCount() > 0);

        Instant captured = subIfd == null ? null
            : toInstant(subIfd.getDate(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL, null, UTC));
        Instant modified = ifd0 == null ? null
            : toInstant(ifd0.getDate(ExifIFD0Directory.TAG_DATETIME, null, UTC));

        return new MediaMetadata(capturePresent, textFields(metadata),
                                 width(metadata), height(metadata), captured, modified);
    }

    public MediaMetadata fromProbe(VideoProbe probe) {
        boolean capturePresent = probe.creationTime() != null
            || probe.tags().keySet().stream().anyMatch(k -> k.endsWith("make") || k.endsWith("model"));
        return new MediaMetadata(capturePresent, probe.tags(), probe.width(), probe.height(),
                                 probe.creationTime(), null);
    }

    private static Map<String, String> textFields(Metadata metadata) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Directory directory : metadata.getDirectories()) {
            if (directory instanceof XmpDirectory xmp) {
                xmp.getXmpProperties().forEach((path, value) -> {
                    int colon = path.lastIndexOf(':');
                    put(fields, colon >= 0 ? path.substring(colon + 1) : path, value);
                });
                continue;
            }
            for (Tag tag : directory.getTags()) {
                String description = tag.getDescription();
                if (description == null) continue;
                if (PNG_TEXT.equals(tag.getTagName())) {
                    // PNG tEXt/iTXt chunks are described as "keyword: text"
                    int sep = description.indexOf(": ");
                    if (sep > 0) {
                        put(fields, description.substring(0, sep), description.substring(sep + 2));
                        continue;
                    }
                }
                put(fields, tag.getTagName(), description);
            }
        }
        return fields;
    }

    private static void put(Map<String, String> fields, String key, String value) {
        if (key == null || value == null || value.isBlank()) return;
        fields.merge(key.toLowerCase(Locale.ROOT), value, (a, b) -> a.equals(b) ? a : a + " | " + b);
    }

    private static Integer width(Metadata metadata) {
        JpegDirectory jpeg = metadata.getFirstDirectoryOfType(JpegDirectory.class);
        if (jpeg != null && jpeg.getInteger(JpegDirectory.TAG_IMAGE_WIDTH) != null) {
            return jpeg.getInteger(JpegDirectory.TAG_IMAGE_WIDTH);
        }
        for (PngDirectory png : metadata.getDirectoriesOfType(PngDirectory.class)) {
            if (png.getInteger(PngDirectory.TAG_IMAGE_WIDTH) != null) {
                return png.getInteger(PngDirectory.TAG_IMAGE_WIDTH);
            }
        }
        ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        return exif == null ? null : exif.getInteger(ExifSubIFDDirectory.TAG_EXIF_IMAGE_WIDTH);
    }

    private static Integer height(Metadata metadata) {
        JpegDirectory jpeg = metadata.getFirstDirectoryOfType(JpegDirectory.class);
        if (jpeg != null && jpeg.getInteger(JpegDirectory.TAG_IMAGE_HEIGHT) != null) {
            return jpeg.getInteger(JpegDirectory.TAG_IMAGE_HEIGHT);
        }
        for (PngDirectory png : metadata.getDirectoriesOfType(PngDirectory.class)) {
            if (png.getInteger(PngDirectory.TAG_IMAGE_HEIGHT) != null) {
                return png.getInteger(PngDirectory.TAG_IMAGE_HEIGHT);
            }
        }
        ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        return exif == null ? null : exif.getInteger(ExifSubIFDDirectory.TAG_EXIF_IMAGE_HEIGHT);
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
