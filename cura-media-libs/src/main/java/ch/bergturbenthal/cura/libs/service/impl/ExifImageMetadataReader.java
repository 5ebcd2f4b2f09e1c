package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.DecodedImage;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.model.FileFacts;
import ch.bergturbenthal.cura.libs.model.MediaMetadata;
import ch.bergturbenthal.cura.libs.model.MediaType;
import ch.bergturbenthal.cura.libs.model.SourceFormat;
import ch.bergturbenthal.cura.libs.service.ImageDecoder;
import ch.bergturbenthal.cura.libs.service.ImageMetadataReader;
import ch.bergturbenthal.cura.libs.util.GpsCoordinates;
import ch.bergturbenthal.cura.libs.util.Orientation;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.tiff.TiffField;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.GpsTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.taginfos.TagInfo;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Dimension;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Optional;

@Slf4j
@Service
public class ExifImageMetadataReader implements ImageMetadataReader {
    private static final DateTimeFormatter EXIF_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");
    private final ImageDecoder imageDecoder;

    public ExifImageMetadataReader(final ImageDecoder imageDecoder) {
        this.imageDecoder = imageDecoder;
    }

    @Override
    public MediaMetadata readImage(final Path path) throws MediaException {
        final FileFacts fileFacts = FileFacts.read(path);
        final File file = path.toFile();
        final ExifValues exif = readExif(file);

        final int width;
        final int height;
        int orientation = exif.getOrientation();
        final Optional<SourceFormat> formatByEnding = SourceFormat
                .fromExtension(FilenameUtils.getExtension(path.getFileName().toString()));
        // the header of a raw file often describes the embedded preview only
        final boolean fullDecode = formatByEnding.map(ExifImageMetadataReader::needsFullDecode).orElse(false);
        final Optional<Dimension> headerSize = fullDecode ? Optional.empty() : readHeaderSize(file);
        if (headerSize.isPresent()) {
            final boolean swap = Orientation.swapsDimensions(orientation);
            width = swap ? headerSize.get().height : headerSize.get().width;
            height = swap ? headerSize.get().width : headerSize.get().height;
        } else {
            final SourceFormat format = formatByEnding.isPresent() ? formatByEnding.get()
                    : imageDecoder.detectFormat(path);
            if (!needsFullDecode(format))
                throw new MediaException(ErrorKind.DECODE_FAILURE, "Cannot determine dimensions of " + path);
            final DecodedImage decoded = imageDecoder.decode(path, format);
            width = decoded.getImage().getWidth();
            height = decoded.getImage().getHeight();
            if (decoded.isOrientationApplied())
                orientation = 1;
        }

        Double latitude = null;
        Double longitude = null;
        if (exif.getLatitude() != null && exif.getLongitude() != null) {
            latitude = exif.getLatitude();
            longitude = exif.getLongitude();
        }
        return MediaMetadata.builder()
                .mediaType(MediaType.IMAGE)
                .captureDate(exif.getCaptureDate())
                .cameraMake(exif.getCameraMake())
                .cameraModel(exif.getCameraModel())
                .gpsLatitude(latitude)
                .gpsLongitude(longitude)
                .width(width)
                .height(height)
                .orientation(orientation)
                .fileSize(fileFacts.getSize())
                .fileModified(fileFacts.getModified())
                .build();
    }

    @Override
    public int readOrientation(final Path path) throws MediaException {
        FileFacts.read(path);
        return readExif(path.toFile()).getOrientation();
    }

    private static boolean needsFullDecode(final SourceFormat format) {
        return format == SourceFormat.RAW || format == SourceFormat.HEIC;
    }

    private static Optional<Dimension> readHeaderSize(final File file) {
        try {
            final Dimension size = Imaging.getImageSize(file);
            if (size != null && size.width > 0 && size.height > 0)
                return Optional.of(size);
        } catch (ImageReadException | IOException | RuntimeException e) {
            log.debug("Imaging cannot read size of {}", file, e);
        }
        try (ImageInputStream inputStream = ImageIO.createImageInputStream(file)) {
            if (inputStream == null)
                return Optional.empty();
            final Iterator<ImageReader> readers = ImageIO.getImageReaders(inputStream);
            if (!readers.hasNext())
                return Optional.empty();
            final ImageReader reader = readers.next();
            try {
                reader.setInput(inputStream);
                return Optional.of(new Dimension(reader.getWidth(0), reader.getHeight(0)));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("ImageIO cannot read size of {}", file, e);
            return Optional.empty();
        }
    }

    private static ExifValues readExif(final File file) {
        final ImageMetadata metadata;
        try {
            metadata = Imaging.getMetadata(file);
        } catch (ImageReadException | IOException | RuntimeException e) {
            log.debug("No metadata readable from {}", file, e);
            return ExifValues.builder().orientation(1).build();
        }
        final TiffImageMetadata tiffMetadata;
        if (metadata instanceof JpegImageMetadata)
            tiffMetadata = ((JpegImageMetadata) metadata).getExif();
        else if (metadata instanceof TiffImageMetadata)
            tiffMetadata = (TiffImageMetadata) metadata;
        else
            tiffMetadata = null;
        if (tiffMetadata == null)
            return ExifValues.builder().orientation(1).build();

        final ExifValues.ExifValuesBuilder builder = ExifValues.builder();
        builder.orientation(readOrientationField(file, tiffMetadata));
        builder.cameraMake(readString(file, tiffMetadata, TiffTagConstants.TIFF_TAG_MAKE));
        builder.cameraModel(readString(file, tiffMetadata, TiffTagConstants.TIFF_TAG_MODEL));
        Instant captureDate = readDate(file, tiffMetadata, ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL);
        if (captureDate == null)
            captureDate = readDate(file, tiffMetadata, TiffTagConstants.TIFF_TAG_DATE_TIME);
        builder.captureDate(captureDate);
        try {
            final Double latitude = readCoordinate(tiffMetadata, GpsTagConstants.GPS_TAG_GPS_LATITUDE,
                    GpsTagConstants.GPS_TAG_GPS_LATITUDE_REF, true);
            final Double longitude = readCoordinate(tiffMetadata, GpsTagConstants.GPS_TAG_GPS_LONGITUDE,
                    GpsTagConstants.GPS_TAG_GPS_LONGITUDE_REF, false);
            if (latitude != null && longitude != null) {
                builder.latitude(latitude);
                builder.longitude(longitude);
            }
        } catch (MediaException | ImageReadException | RuntimeException e) {
            log.warn("Ignoring GPS position of {}: {}", file, e.getMessage());
        }
        return builder.build();
    }

    private static int readOrientationField(final File file, final TiffImageMetadata metadata) {
        try {
            final TiffField field = metadata.findField(TiffTagConstants.TIFF_TAG_ORIENTATION);
            if (field == null)
                return 1;
            final int orientation = field.getIntValue();
            if (orientation < 1 || orientation > 8) {
                log.warn("Ignoring invalid orientation {} of {}", orientation, file);
                return 1;
            }
            return orientation;
        } catch (ImageReadException | RuntimeException e) {
            log.warn("Cannot read orientation of {}", file, e);
            return 1;
        }
    }

    private static String readString(final File file, final TiffImageMetadata metadata, final TagInfo tag) {
        try {
            final TiffField field = metadata.findField(tag);
            if (field == null)
                return null;
            final String value = field.getStringValue().replace('\0', ' ').trim();
            return value.isEmpty() ? null : value;
        } catch (ImageReadException | RuntimeException e) {
            log.warn("Cannot read {} of {}", tag.name, file, e);
            return null;
        }
    }

    private static Instant readDate(final File file, final TiffImageMetadata metadata, final TagInfo tag) {
        final String value = readString(file, metadata, tag);
        if (value == null)
            return null;
        try {
            return LocalDateTime.parse(value, EXIF_DATE_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Could not parse date {} of {}", value, file);
            return null;
        }
    }

    private static Double readCoordinate(final TiffImageMetadata metadata, final TagInfo valueTag,
            final TagInfo refTag, final boolean latitude) throws ImageReadException, MediaException {
        final TiffField valueField = metadata.findField(valueTag, true);
        if (valueField == null)
            return null;
        final TiffField refField = metadata.findField(refTag, true);
        final String ref = refField == null ? null : refField.getStringValue();
        return GpsCoordinates.toDecimalDegrees(valueField.getDoubleArrayValue(), ref, latitude);
    }

    @Value
    @Builder
    private static class ExifValues {
        int orientation;
        String cameraMake;
        String cameraModel;
        Instant captureDate;
        Double latitude;
        Double longitude;
    }
}
