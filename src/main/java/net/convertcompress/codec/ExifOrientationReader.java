package net.convertcompress.codec;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.convertcompress.model.image.Orientation;

/**
 * Reads the EXIF block from the APP1 segment of a JPEG file without decoding pixel data,
 * and reads or rewrites its orientation tag. Non-JPEG input and files without the tag
 * report {@link Orientation#UP}.
 */
final class ExifOrientationReader {

    private static final int SOI = 0xFFD8;
    private static final int APP1 = 0xE1;
    private static final int SOS = 0xDA;
    private static final int EOI = 0xD9;
    private static final int ORIENTATION_TAG = 0x0112;
    private static final int SHORT_TYPE = 3;
    private static final byte[] EXIF_HEADER = "Exif\0\0".getBytes(StandardCharsets.ISO_8859_1);

    private ExifOrientationReader() {
    }

    static Orientation read(Path source) throws IOException {
        return orientationOf(readExifBlock(source));
    }

    static Orientation read(InputStream input) throws IOException {
        return orientationOf(readExifBlock(input));
    }

    /** The APP1 payload starting at the {@code Exif\0\0} header, or null. */
    static byte[] readExifBlock(Path source) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(source))) {
            return readExifBlock(in);
        }
    }

    static byte[] readExifBlock(InputStream input) throws IOException {
        DataInputStream in = new DataInputStream(input);
        try {
            if (in.readUnsignedShort() != SOI) {
                return null;
            }
            while (true) {
                int prefix = in.readUnsignedByte();
                if (prefix != 0xFF) {
                    return null;
                }
                int marker = in.readUnsignedByte();
                while (marker == 0xFF) {
                    marker = in.readUnsignedByte();
                }
                if (marker == SOS || marker == EOI) {
                    return null;
                }
                int length = in.readUnsignedShort();
                if (length < 2) {
                    return null;
                }
                byte[] segment = new byte[length - 2];
                in.readFully(segment);
                if (marker == APP1 && startsWithExifHeader(segment)) {
                    return segment;
                }
            }
        } catch (EOFException truncated) {
            return null;
        }
    }

    static Orientation orientationOf(byte[] exifBlock) {
        ByteBuffer tiff = tiffView(exifBlock);
        int entry = tiff == null ? -1 : orientationEntryOffset(tiff);
        if (entry < 0) {
            return Orientation.UP;
        }
        return Orientation.fromExifValue(tiff.getShort(entry + 8) & 0xFFFF);
    }

    /**
     * Copy of {@code exifBlock} with its orientation tag set to upright. Blocks without
     * the tag are returned unchanged.
     */
    static byte[] withUprightOrientation(byte[] exifBlock) {
        byte[] copy = exifBlock.clone();
        ByteBuffer tiff = tiffView(copy);
        int entry = tiff == null ? -1 : orientationEntryOffset(tiff);
        if (entry >= 0) {
            tiff.putShort(entry + 2, (short) SHORT_TYPE);
            tiff.putInt(entry + 4, 1);
            tiff.putShort(entry + 8, (short) Orientation.UP.exifValue());
            tiff.putShort(entry + 10, (short) 0);
        }
        return copy;
    }

    private static boolean startsWithExifHeader(byte[] segment) {
        if (segment.length < EXIF_HEADER.length) {
            return false;
        }
        for (int i = 0; i < EXIF_HEADER.length; i++) {
            if (segment[i] != EXIF_HEADER[i]) {
                return false;
            }
        }
        return true;
    }

    // Byte-ordered view of the TIFF structure that follows the header; writes go through to the block.
    private static ByteBuffer tiffView(byte[] exifBlock) {
        if (exifBlock == null || !startsWithExifHeader(exifBlock)) {
            return null;
        }
        ByteBuffer tiff = ByteBuffer.wrap(exifBlock, EXIF_HEADER.length, exifBlock.length - EXIF_HEADER.length).slice();
        if (tiff.remaining() < 8) {
            return null;
        }
        byte first = tiff.get(0);
        byte second = tiff.get(1);
        if (first == 'I' && second == 'I') {
            tiff.order(ByteOrder.LITTLE_ENDIAN);
        } else if (first == 'M' && second == 'M') {
            tiff.order(ByteOrder.BIG_ENDIAN);
        } else {
            return null;
        }
        if ((tiff.getShort(2) & 0xFFFF) != 0x002A) {
            return null;
        }
        return tiff;
    }

    private static int orientationEntryOffset(ByteBuffer tiff) {
        long ifdOffset = tiff.getInt(4) & 0xFFFFFFFFL;
        if (ifdOffset + 2 > tiff.limit()) {
            return -1;
        }
        int entries = tiff.getShort((int) ifdOffset) & 0xFFFF;
        for (int i = 0; i < entries; i++) {
            int entryOffset = (int) ifdOffset + 2 + i * 12;
            if (entryOffset + 12 > tiff.limit()) {
                break;
            }
            if ((tiff.getShort(entryOffset) & 0xFFFF) == ORIENTATION_TAG) {
                return entryOffset;
            }
        }
        return -1;
    }
}
