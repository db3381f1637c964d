package com.visualoom.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.file.FileTypeDirectory;
import com.drew.metadata.jpeg.JpegDirectory;
import com.drew.metadata.png.PngDirectory;
import com.drew.metadata.webp.WebpDirectory;
import com.visualoom.model.ImageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the descriptive fields of an image file: format, pixel dimensions,
 * size on disk and file timestamps.
 *
 * Raster formats are read from their header through ImageIO; camera RAW,
 * WebP and HEIC files (and anything ImageIO cannot open) go through
 * metadata-extractor. Files neither can identify yield an empty result.
 */
@Component
public class MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    private static final Set<String> RASTER_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "bmp", "tiff", "tif", "gif", "webp", "heic");

    private static final Set<String> RAW_EXTENSIONS = Set.of(
            "cr2", "cr3", "nef", "nrw", "arw", "rw2", "orf", "raf", "sr2",
            "pef", "dng", "erf", "3fr", "srw", "x3f", "mef", "mos", "rwl", "kc2");

    /**
     * Returns true if the file has a supported raster or camera RAW extension.
     */
    public boolean isSupportedImage(Path path) {
        String ext = extensionOf(path);
        return RASTER_EXTENSIONS.contains(ext) || RAW_EXTENSIONS.contains(ext);
    }

    /**
     * Extracts metadata for one file.
     *
     * The returned record carries the file name as a provisional id; it is not
     * unique across folders and must be replaced before the record is stored.
     *
     * @param file image file
     * @return the record, or empty if the file cannot be read as an image
     */
    public Optional<ImageRecord> extract(Path file) {
        Path path = file.toAbsolutePath().normalize();
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            if (!attrs.isRegularFile()) {
                log.warn("Skipping non-regular file: {}", path);
                return Optional.empty();
            }

            Optional<ImageInfo> info = RAW_EXTENSIONS.contains(extensionOf(path))
                    ? readWithMetadataExtractor(path).or(() -> readWithImageIo(path))
                    : readWithImageIo(path).or(() -> readWithMetadataExtractor(path));
            if (info.isEmpty()) {
                log.warn("Skipping unreadable image: {}", path);
                return Optional.empty();
            }

            ImageRecord record = new ImageRecord();
            record.setId(path.getFileName().toString());
            record.setPath(path.toString());
            record.setFormat(info.get().format);
            record.setWidth(info.get().width);
            record.setHeight(info.get().height);
            record.setSizeBytes(attrs.size());
            record.setCreated(toLocal(attrs.creationTime()));
            record.setModified(toLocal(attrs.lastModifiedTime()));
            return Optional.of(record);
        } catch (IOException | SecurityException e) {
            log.warn("Error reading {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads format and dimensions from the image header without decoding the
     * pixels.
     */
    private Optional<ImageInfo> readWithImageIo(Path path) {
        try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
            if (in == null) {
                return Optional.empty();
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return Optional.of(new ImageInfo(
                        reader.getFormatName().toUpperCase(Locale.ROOT),
                        reader.getWidth(0),
                        reader.getHeight(0)));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("ImageIO could not read {}: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ImageInfo> readWithMetadataExtractor(Path path) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(path.toFile());
            FileTypeDirectory fileType = metadata.getFirstDirectoryOfType(FileTypeDirectory.class);
            String format = fileType != null
                    ? fileType.getString(FileTypeDirectory.TAG_DETECTED_FILE_TYPE_NAME)
                    : null;
            if (format == null || format.isBlank()) {
                return Optional.empty();
            }

            Integer width = firstInteger(metadata,
                    new DimensionTag(JpegDirectory.class, JpegDirectory.TAG_IMAGE_WIDTH),
                    new DimensionTag(PngDirectory.class, PngDirectory.TAG_IMAGE_WIDTH),
                    new DimensionTag(WebpDirectory.class, WebpDirectory.TAG_IMAGE_WIDTH),
                    new DimensionTag(ExifSubIFDDirectory.class, ExifSubIFDDirectory.TAG_EXIF_IMAGE_WIDTH),
                    new DimensionTag(ExifIFD0Directory.class, ExifIFD0Directory.TAG_IMAGE_WIDTH));
            Integer height = firstInteger(metadata,
                    new DimensionTag(JpegDirectory.class, JpegDirectory.TAG_IMAGE_HEIGHT),
                    new DimensionTag(PngDirectory.class, PngDirectory.TAG_IMAGE_HEIGHT),
                    new DimensionTag(WebpDirectory.class, WebpDirectory.TAG_IMAGE_HEIGHT),
                    new DimensionTag(ExifSubIFDDirectory.class, ExifSubIFDDirectory.TAG_EXIF_IMAGE_HEIGHT),
                    new DimensionTag(ExifIFD0Directory.class, ExifIFD0Directory.TAG_IMAGE_HEIGHT));
            return Optional.of(new ImageInfo(format.toUpperCase(Locale.ROOT), width, height));
        } catch (ImageProcessingException | IOException | RuntimeException e) {
            log.debug("metadata-extractor could not read {}: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Integer firstInteger(Metadata metadata, DimensionTag... candidates) {
        for (DimensionTag candidate : candidates) {
            Directory dir = metadata.getFirstDirectoryOfType(candidate.directory);
            if (dir != null && dir.containsTag(candidate.tag)) {
                Integer value = dir.getInteger(candidate.tag);
                if (value != null && value > 0) {
                    return value;
                }
            }
        }
        return null;
    }

    private static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1);
    }

    private static LocalDateTime toLocal(FileTime time) {
        return LocalDateTime.ofInstant(time.toInstant(), ZoneId.systemDefault());
    }

    private static final class ImageInfo {
        final String format;
        final Integer width;
        final Integer height;

        ImageInfo(String format, Integer width, Integer height) {
            this.format = format;
            this.width = width;
            this.height = height;
        }
    }

    private static final class DimensionTag {
        final Class<? extends Directory> directory;
        final int tag;

        DimensionTag(Class<? extends Directory> directory, int tag) {
            this.directory = directory;
            this.tag = tag;
        }
    }
}
