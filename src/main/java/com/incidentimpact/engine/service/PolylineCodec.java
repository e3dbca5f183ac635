package com.incidentimpact.engine.service;

import com.incidentimpact.engine.dto.DecodeResult;
import com.incidentimpact.engine.exception.PolylineDecodeException;
import com.incidentimpact.engine.model.LatLon;
import com.incidentimpact.engine.model.PolylineFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Decodes and encodes route geometries in the Google encoded-polyline format and the
 * HERE flexible-polyline format.
 *
 * Google: each value is the zig-zag encoded delta from the previous vertex, scaled by
 * 1e5, split into 5-bit chunks offset by 63 ('?' to '~').
 *
 * HERE: a URL-safe base64 alphabet carries unsigned varints of 5-bit chunks. The first
 * two varints are the format version (always 1) and a header holding the 2D precision,
 * the third-dimension type and its precision. Third-dimension values are skipped.
 *
 * Stateless and safe to share across request threads.
 */
@Component
@Slf4j
public class PolylineCodec {

    static final int GOOGLE_PRECISION = 5;
    static final int HERE_FORMAT_VERSION = 1;
    static final int DEFAULT_HERE_PRECISION = 5;

    private static final String HERE_ALPHABET =
        "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";
    private static final int[] HERE_DECODING_TABLE = new int[128];

    // Longest chunk run that still fits a 64-bit accumulator.
    private static final int MAX_SHIFT = 60;

    static {
        Arrays.fill(HERE_DECODING_TABLE, -1);
        for (int i = 0; i < HERE_ALPHABET.length(); i++) {
            HERE_DECODING_TABLE[HERE_ALPHABET.charAt(i)] = i;
        }
    }

    @Value("${incident-impact.polyline.max-length:100000}")
    private int maxLength = 100_000;

    public PolylineCodec() {
    }

    PolylineCodec(int maxLength) {
        this.maxLength = maxLength;
    }

    /**
     * Decodes an encoded polyline. Malformed input produces a failed result with an empty
     * coordinate list and a warning; this method never throws on bad input.
     */
    public DecodeResult decode(String encoded, PolylineFormat format) {
        try {
            List<LatLon> coordinates = decodeOrThrow(encoded, format);
            return DecodeResult.success(coordinates);
        } catch (PolylineDecodeException e) {
            log.warn("Malformed {} polyline (length={}): {}", format, lengthOf(encoded), e.getMessage());
            return DecodeResult.failure(e.getMessage());
        }
    }

    /**
     * Strict variant of {@link #decode}.
     *
     * @throws PolylineDecodeException when the input is malformed or exceeds the length limit
     */
    public List<LatLon> decodeOrThrow(String encoded, PolylineFormat format) {
        if (encoded == null || encoded.isEmpty()) {
            return List.of();
        }
        if (encoded.length() > maxLength) {
            throw new PolylineDecodeException(
                "Polyline length " + encoded.length() + " exceeds limit " + maxLength, maxLength);
        }
        return switch (format) {
            case GOOGLE -> decodeGoogle(encoded);
            case HERE -> decodeHere(encoded);
        };
    }

    // ------------------------------------------------------------------
    // Google
    // ------------------------------------------------------------------

    private List<LatLon> decodeGoogle(String encoded) {
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            if (c < 63 || c > 126) {
                throw new PolylineDecodeException("Illegal character '" + printable(c) + "' in polyline", i);
            }
        }

        List<LatLon> coordinates = new ArrayList<>();
        int[] cursor = {0};
        long lat = 0;
        long lon = 0;
        double factor = Math.pow(10, GOOGLE_PRECISION);

        while (cursor[0] < encoded.length()) {
            lat += zigZagDecode(readGoogleVarint(encoded, cursor));
            if (cursor[0] >= encoded.length()) {
                throw new PolylineDecodeException("Polyline ends after a latitude without its longitude", cursor[0]);
            }
            lon += zigZagDecode(readGoogleVarint(encoded, cursor));
            coordinates.add(checkedCoordinate(lat / factor, lon / factor, cursor[0]));
        }
        return coordinates;
    }

    private long readGoogleVarint(String encoded, int[] cursor) {
        long result = 0;
        int shift = 0;
        int chunk;
        do {
            if (cursor[0] >= encoded.length()) {
                throw new PolylineDecodeException("Polyline ends in the middle of a value", cursor[0]);
            }
            if (shift > MAX_SHIFT) {
                throw new PolylineDecodeException("Encoded value is too long", cursor[0]);
            }
            chunk = encoded.charAt(cursor[0]++) - 63;
            result |= (long) (chunk & 0x1f) << shift;
            shift += 5;
        } while (chunk >= 0x20);
        return result;
    }

    /**
     * Encodes coordinates in the Google format at precision 5.
     */
    public String encodeGoogle(List<LatLon> coordinates) {
        StringBuilder sb = new StringBuilder();
        double factor = Math.pow(10, GOOGLE_PRECISION);
        long lastLat = 0;
        long lastLon = 0;
        for (LatLon c : coordinates) {
            long lat = Math.round(c.lat() * factor);
            long lon = Math.round(c.lon() * factor);
            writeGoogleVarint(zigZagEncode(lat - lastLat), sb);
            writeGoogleVarint(zigZagEncode(lon - lastLon), sb);
            lastLat = lat;
            lastLon = lon;
        }
        return sb.toString();
    }

    private void writeGoogleVarint(long value, StringBuilder sb) {
        while (value >= 0x20) {
            sb.append((char) ((0x20 | (value & 0x1f)) + 63));
            value >>>= 5;
        }
        sb.append((char) (value + 63));
    }

    // ------------------------------------------------------------------
    // HERE flexible polyline
    // ------------------------------------------------------------------

    private List<LatLon> decodeHere(String encoded) {
        List<Long> values = readHereVarints(encoded);
        if (values.size() < 2) {
            throw new PolylineDecodeException("Flexible polyline header is incomplete", encoded.length());
        }
        long version = values.get(0);
        if (version != HERE_FORMAT_VERSION) {
            throw new PolylineDecodeException("Unsupported flexible polyline version " + version, 0);
        }
        long header = values.get(1);
        int precision = (int) (header & 0x0f);
        int thirdDimension = (int) ((header >> 4) & 0x07);
        int stride = thirdDimension == 0 ? 2 : 3;

        int payload = values.size() - 2;
        if (payload % stride != 0) {
            throw new PolylineDecodeException(
                "Flexible polyline carries " + payload + " values, not a multiple of " + stride, encoded.length());
        }

        double factor = Math.pow(10, precision);
        List<LatLon> coordinates = new ArrayList<>(payload / stride);
        long lat = 0;
        long lon = 0;
        for (int i = 2; i < values.size(); i += stride) {
            lat += zigZagDecode(values.get(i));
            lon += zigZagDecode(values.get(i + 1));
            coordinates.add(checkedCoordinate(lat / factor, lon / factor, i));
        }
        return coordinates;
    }

    private List<Long> readHereVarints(String encoded) {
        List<Long> values = new ArrayList<>();
        long result = 0;
        int shift = 0;
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            int chunk = c < HERE_DECODING_TABLE.length ? HERE_DECODING_TABLE[c] : -1;
            if (chunk < 0) {
                throw new PolylineDecodeException("Illegal character '" + printable(c) + "' in flexible polyline", i);
            }
            if (shift > MAX_SHIFT) {
                throw new PolylineDecodeException("Encoded value is too long", i);
            }
            result |= (long) (chunk & 0x1f) << shift;
            if ((chunk & 0x20) == 0) {
                values.add(result);
                result = 0;
                shift = 0;
            } else {
                shift += 5;
            }
        }
        if (shift > 0) {
            throw new PolylineDecodeException("Flexible polyline ends in the middle of a value", encoded.length());
        }
        return values;
    }

    /**
     * Encodes 2D coordinates in the HERE flexible format.
     *
     * @param precision decimal digits kept, 0 to 15
     */
    public String encodeHere(List<LatLon> coordinates, int precision) {
        if (precision < 0 || precision > 15) {
            throw new IllegalArgumentException("Precision must be within [0, 15]: " + precision);
        }
        StringBuilder sb = new StringBuilder();
        writeHereVarint(HERE_FORMAT_VERSION, sb);
        writeHereVarint(precision, sb);

        double factor = Math.pow(10, precision);
        long lastLat = 0;
        long lastLon = 0;
        for (LatLon c : coordinates) {
            long lat = Math.round(c.lat() * factor);
            long lon = Math.round(c.lon() * factor);
            writeHereVarint(zigZagEncode(lat - lastLat), sb);
            writeHereVarint(zigZagEncode(lon - lastLon), sb);
            lastLat = lat;
            lastLon = lon;
        }
        return sb.toString();
    }

    public String encodeHere(List<LatLon> coordinates) {
        return encodeHere(coordinates, DEFAULT_HERE_PRECISION);
    }

    private void writeHereVarint(long value, StringBuilder sb) {
        while (value > 0x1f) {
            sb.append(HERE_ALPHABET.charAt((int) ((value & 0x1f) | 0x20)));
            value >>>= 5;
        }
        sb.append(HERE_ALPHABET.charAt((int) value));
    }

    // ------------------------------------------------------------------
    // Shared
    // ------------------------------------------------------------------

    private static long zigZagDecode(long value) {
        return (value & 1) != 0 ? ~(value >> 1) : (value >> 1);
    }

    private static long zigZagEncode(long value) {
        return value < 0 ? ~(value << 1) : (value << 1);
    }

    private static LatLon checkedCoordinate(double lat, double lon, int position) {
        LatLon coordinate = new LatLon(lat, lon);
        if (!coordinate.isInRange()) {
            throw new PolylineDecodeException(
                String.format("Decoded coordinate (%.5f, %.5f) is out of range", lat, lon), position);
        }
        return coordinate;
    }

    private static String printable(char c) {
        return Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : String.valueOf(c);
    }

    private static int lengthOf(String encoded) {
        return encoded == null ? 0 : encoded.length();
    }
}
