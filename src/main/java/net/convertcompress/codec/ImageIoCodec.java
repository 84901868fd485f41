package net.convertcompress.codec;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.exception.BackgroundRemovalUnavailableException;
import net.convertcompress.exception.ImageExportException;
import net.convertcompress.exception.ImageLoadException;
import net.convertcompress.exception.ImageTransformException;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.model.image.ImageMetadata;
import net.convertcompress.model.image.Orientation;
import net.convertcompress.model.image.PixelSize;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

/**
 * Default {@link ImageCodec} built on {@code javax.imageio} and Java2D.
 *
 * <p>Capabilities mirror the ImageIO plugins present at construction time. Background
 * removal has no ImageIO equivalent and always reports
 * {@link BackgroundRemovalUnavailableException}.</p>
 */
@Slf4j
public class ImageIoCodec implements ImageCodec {

    public static final double DEFAULT_LOSSY_QUALITY = 0.9;

    private static final Set<ImageFormat> ALPHA_FORMATS = Set.of(
        ImageFormat.PNG, ImageFormat.GIF, ImageFormat.TIFF, ImageFormat.WEBP,
        ImageFormat.HEIC, ImageFormat.ICO, ImageFormat.ICNS);
    private static final Set<ImageFormat> LOSSY_FORMATS = Set.of(ImageFormat.JPEG, ImageFormat.WEBP, ImageFormat.HEIC);
    private static final String TEXT_NODE = "Text";
    private static final String TEXT_ENTRY_NODE = "TextEntry";
    private static final String JPEG_NATIVE_FORMAT = "javax_imageio_jpeg_image_1.0";
    private static final int APP1_MARKER = 0xE1;

    private final double defaultLossyQuality;
    private final CodecCapabilities capabilities;

    public ImageIoCodec() {
        this(DEFAULT_LOSSY_QUALITY);
    }

    public ImageIoCodec(double defaultLossyQuality) {
        this.defaultLossyQuality = defaultLossyQuality;
        this.capabilities = new CodecCapabilities(
            toFormats(ImageIO.getReaderMIMETypes()),
            toFormats(ImageIO.getWriterMIMETypes()));
        log.debug("ImageIO codec readable={} writable={}", capabilities.readable(), capabilities.writable());
    }

    @Override
    public EditableImage decode(Path source) {
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            throw new ImageLoadException(source, "file is missing or unreadable");
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(source.toFile())) {
            ImageReader reader = firstReader(input, source);
            try {
                reader.setInput(input, true, false);
                BufferedImage raw = reader.read(0);
                Map<String, String> entries = readTextEntries(reader, source);
                byte[] exif = ExifOrientationReader.readExifBlock(source);
                Orientation orientation = ExifOrientationReader.orientationOf(exif);
                BufferedImage upright = OrientationTransforms.upright(normalize(raw), orientation);
                return new BufferedEditableImage(upright, new ImageMetadata(entries, orientation, exif));
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new ImageLoadException(source, e.getMessage(), e);
        }
    }

    @Override
    public PixelSize readPixelSize(Path source) {
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            throw new ImageLoadException(source, "file is missing or unreadable");
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(source.toFile())) {
            ImageReader reader = firstReader(input, source);
            try {
                reader.setInput(input, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                Orientation orientation = ExifOrientationReader.read(source);
                return orientation.swapsDimensions() ? new PixelSize(height, width) : new PixelSize(width, height);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new ImageLoadException(source, e.getMessage(), e);
        }
    }

    @Override
    public EditableImage transform(EditableImage image, TransformRequest request) {
        if (!(image instanceof BufferedEditableImage current)) {
            throw new ImageTransformException(request.describe(), "image was not decoded by the ImageIO codec");
        }
        if (request instanceof TransformRequest.Scale scale) {
            PixelSize target = scale.target();
            if (target.equals(current.pixelSize())) {
                return current;
            }
            return current.withImage(OrientationTransforms.scale(current.image(), target.width(), target.height()));
        }
        if (request instanceof TransformRequest.Flip flip) {
            return current.withImage(OrientationTransforms.flip(current.image(), flip.axis()));
        }
        if (request instanceof TransformRequest.RemoveBackground) {
            throw new BackgroundRemovalUnavailableException("ImageIO has no foreground segmentation support");
        }
        throw new ImageTransformException(request.describe(), "unsupported transform");
    }

    @Override
    public byte[] encode(EditableImage image, EncodeRequest request) {
        if (!(image instanceof BufferedEditableImage current)) {
            throw new ImageExportException(null, "image was not decoded by the ImageIO codec");
        }
        ImageFormat format = request.format();
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByMIMEType(format.identifier());
        if (!writers.hasNext()) {
            throw new ImageExportException(null, "no ImageIO writer for " + format);
        }
        ImageWriter writer = writers.next();
        BufferedImage prepared = prepareForFormat(current.image(), format);
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            applyQuality(param, format, request.quality());
            IIOMetadata metadata = buildMetadata(writer, prepared, param, format, request.metadata());
            try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
                writer.setOutput(ios);
                writer.write(null, new IIOImage(prepared, null, metadata), param);
            }
            byte[] encoded = baos.toByteArray();
            log.debug("Encoded {} image {} to {} bytes", format, current.pixelSize(), encoded.length);
            return encoded;
        } catch (IOException e) {
            throw new ImageExportException(null, "encoding " + format + " failed: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    @Override
    public CodecCapabilities queryCapabilities() {
        return capabilities;
    }

    private static ImageReader firstReader(ImageInputStream input, Path source) {
        if (input == null) {
            throw new ImageLoadException(source, "cannot open image stream");
        }
        Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
        if (!readers.hasNext()) {
            throw new ImageLoadException(source, "unsupported or corrupt image data");
        }
        return readers.next();
    }

    private static Map<String, String> readTextEntries(ImageReader reader, Path source) {
        Map<String, String> entries = new LinkedHashMap<>();
        try {
            IIOMetadata metadata = reader.getImageMetadata(0);
            if (metadata == null || !metadata.isStandardMetadataFormatSupported()) {
                return entries;
            }
            Node root = metadata.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
            for (Node child = root.getFirstChild(); child != null; child = child.getNextSibling()) {
                if (!TEXT_NODE.equals(child.getNodeName())) {
                    continue;
                }
                for (Node entry = child.getFirstChild(); entry != null; entry = entry.getNextSibling()) {
                    NamedNodeMap attributes = entry.getAttributes();
                    Node keyword = attributes == null ? null : attributes.getNamedItem("keyword");
                    Node value = attributes == null ? null : attributes.getNamedItem("value");
                    if (keyword != null && value != null) {
                        entries.put(keyword.getNodeValue(), value.getNodeValue());
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Ignoring unreadable metadata in {}: {}", source, e.getMessage());
        }
        return entries;
    }

    private static BufferedImage normalize(BufferedImage raw) {
        int type = raw.getType();
        if (type == BufferedImage.TYPE_INT_RGB || type == BufferedImage.TYPE_INT_ARGB) {
            return raw;
        }
        BufferedImage normalized = new BufferedImage(raw.getWidth(), raw.getHeight(), OrientationTransforms.workingType(raw));
        Graphics2D g = normalized.createGraphics();
        try {
            g.drawImage(raw, 0, 0, null);
        } finally {
            g.dispose();
        }
        return normalized;
    }

    private static BufferedImage prepareForFormat(BufferedImage image, ImageFormat format) {
        if (ImageFormat.WBMP.equals(format)) {
            return redraw(image, BufferedImage.TYPE_BYTE_BINARY);
        }
        if (!ALPHA_FORMATS.contains(format) && image.getColorModel().hasAlpha()) {
            return redraw(image, BufferedImage.TYPE_INT_RGB);
        }
        return image;
    }

    // Flattens onto white so transparent regions do not turn black.
    private static BufferedImage redraw(BufferedImage image, int type) {
        BufferedImage target = new BufferedImage(image.getWidth(), image.getHeight(), type);
        Graphics2D g = target.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    private void applyQuality(ImageWriteParam param, ImageFormat format, Double quality) {
        if (!LOSSY_FORMATS.contains(format) || !param.canWriteCompressed()) {
            return;
        }
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        String[] types = param.getCompressionTypes();
        if (param.getCompressionType() == null && types != null && types.length > 0) {
            param.setCompressionType(types[0]);
        }
        double effective = quality != null ? quality : defaultLossyQuality;
        param.setCompressionQuality((float) effective);
    }

    private static IIOMetadata buildMetadata(ImageWriter writer, BufferedImage image, ImageWriteParam param,
                                             ImageFormat format, ImageMetadata source) {
        boolean writeExif = ImageFormat.JPEG.equals(format) && source.hasExif();
        if (source.entries().isEmpty() && !writeExif) {
            return null;
        }
        IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
        if (metadata == null || metadata.isReadOnly()) {
            return null;
        }
        boolean merged = mergeTextEntries(writer, metadata, source);
        boolean exifWritten = writeExif && insertExifSegment(writer, metadata, source.exif());
        return merged || exifWritten ? metadata : null;
    }

    private static boolean mergeTextEntries(ImageWriter writer, IIOMetadata metadata, ImageMetadata source) {
        if (source.entries().isEmpty() || !metadata.isStandardMetadataFormatSupported()) {
            return false;
        }
        IIOMetadataNode root = new IIOMetadataNode(IIOMetadataFormatImpl.standardMetadataFormatName);
        IIOMetadataNode text = new IIOMetadataNode(TEXT_NODE);
        source.entries().forEach((key, value) -> {
            IIOMetadataNode entry = new IIOMetadataNode(TEXT_ENTRY_NODE);
            entry.setAttribute("keyword", key);
            entry.setAttribute("value", value);
            text.appendChild(entry);
        });
        root.appendChild(text);
        try {
            metadata.mergeTree(IIOMetadataFormatImpl.standardMetadataFormatName, root);
            return true;
        } catch (IIOInvalidTreeException | UnsupportedOperationException e) {
            log.debug("Writer {} rejected text metadata, encoding without it: {}",
                writer.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    // The EXIF block goes in as an APP1 marker at the head of the JPEG marker sequence.
    private static boolean insertExifSegment(ImageWriter writer, IIOMetadata metadata, byte[] exif) {
        if (!JPEG_NATIVE_FORMAT.equals(metadata.getNativeMetadataFormatName())) {
            return false;
        }
        try {
            Node root = metadata.getAsTree(JPEG_NATIVE_FORMAT);
            Node markerSequence = findChild(root, "markerSequence");
            if (markerSequence == null) {
                return false;
            }
            IIOMetadataNode app1 = new IIOMetadataNode("unknown");
            app1.setAttribute("MarkerTag", String.valueOf(APP1_MARKER));
            app1.setUserObject(ExifOrientationReader.withUprightOrientation(exif));
            markerSequence.insertBefore(app1, markerSequence.getFirstChild());
            metadata.setFromTree(JPEG_NATIVE_FORMAT, root);
            return true;
        } catch (IIOInvalidTreeException | UnsupportedOperationException e) {
            log.debug("Writer {} rejected the EXIF segment, encoding without it: {}",
                writer.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    private static Node findChild(Node parent, String name) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (name.equals(child.getNodeName())) {
                return child;
            }
        }
        return null;
    }

    private static Set<ImageFormat> toFormats(String[] mimeTypes) {
        Set<ImageFormat> formats = new LinkedHashSet<>();
        for (String mimeType : mimeTypes) {
            if (mimeType != null && !mimeType.isBlank()) {
                formats.add(ImageFormat.of(mimeType));
            }
        }
        return formats;
    }
}
