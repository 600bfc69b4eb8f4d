package io.synthtools.matcher.address;

import javax.annotation.concurrent.Immutable;

/**
 * An IPv4 or IPv6 CIDR block, held as its lowest and highest address.
 */
@Immutable
public final class CIDR {

    /**
     * Binary representation of these bytes is 1's followed by all 0's. The number of 0's is equal to the array index.
     * So the binary values are: 11111111, 11111110, 11111100, 11111000, 11110000, 11100000, 11000000, 10000000, 00000000
     */
    private final static byte[] LEADING_MIN_BITS = { (byte) 0xff, (byte) 0xfe, (byte) 0xfc, (byte) 0xf8, (byte) 0xf0, (byte) 0xe0, (byte) 0xc0, (byte) 0x80, 0x00 };

    /**
     * Binary representation of these bytes is 0's followed by all 1's. The number of 1's is equal to the array index.
     * So the binary values are: 00000000, 00000001, 00000011, 00000111, 00001111, 00011111, 00111111, 01111111, 11111111
     */
    private final static byte[] TRAILING_MAX_BITS = { 0x0, 0x01, 0x03, 0x07, 0x0f, 0x1f, 0x3f, 0x7f, (byte) 0xff };

    private final String text;
    private final byte[] bottom;
    private final byte[] top;

    private CIDR(final String text, final byte[] bottom, final byte[] top) {
        this.text = text;
        this.bottom = bottom;
        this.top = top;
    }

    /**
     * @param cidr e.g. "192.168.0.0/16" or "fe80::/10"
     * @throws IllegalArgumentException if the block is malformed
     */
    public static CIDR cidr(final String cidr) throws IllegalArgumentException {

        String[] slashed = cidr.split("/");
        if (slashed.length != 2) {
            barf("Malformed CIDR, one '/' required");
        }
        int maskBits = -1;
        try {
            maskBits = Integer.parseInt(slashed[1]);
        } catch (NumberFormatException e) {
            barf("Malformed CIDR, mask bits must be an integer");
        }
        if (maskBits < 0) {
            barf("Malformed CIDR, mask bits must not be negative");
        }

        byte[] providedIp = IPAddress.toBytes(slashed[0]);
        if (maskBits > providedIp.length * 8) {
            barf("Mask bits must be <= " + providedIp.length * 8);
        }

        return new CIDR(cidr, computeBottomBytes(providedIp, maskBits), computeTopBytes(providedIp, maskBits));
    }

    /**
     * @param address 4 or 16 address bytes
     * @return true if the address lies in this block; addresses of the other family never do
     */
    public boolean contains(final byte[] address) {
        return address.length == bottom.length
                && compareUnsigned(address, bottom) >= 0
                && compareUnsigned(address, top) <= 0;
    }

    public boolean contains(final String address) {
        return contains(IPAddress.toBytes(address));
    }

    /**
     * Calculate the byte representation of the lowest IP address covered by the provided CIDR.
     */
    private static byte[] computeBottomBytes(final byte[] baseBytes, final int maskBits) {

        int variableBits = computeVariableBits(baseBytes, maskBits);

        // Iterate from the least significant byte (right hand side) back to the most significant byte (left hand side).
        byte[] minBytes = new byte[baseBytes.length];
        for (int i = baseBytes.length - 1; i >= 0; i--) {

            // Some or all of the byte is variable: keep the leading fixed bits, zero the trailing variable ones.
            if (variableBits > 0) {
                minBytes[i] = (byte) (baseBytes[i] & LEADING_MIN_BITS[Math.min(8, variableBits)]);
            } else {
                minBytes[i] = baseBytes[i];
            }

            // Subtract 8 variable bits. We're effectively chopping off the least significant byte for next iteration.
            variableBits -= 8;
        }

        return minBytes;
    }

    /**
     * Calculate the byte representation of the highest IP address covered by the provided CIDR.
     */
    private static byte[] computeTopBytes(final byte[] baseBytes, final int maskBits) {

        int variableBits = computeVariableBits(baseBytes, maskBits);

        byte[] maxBytes = new byte[baseBytes.length];
        for (int i = baseBytes.length - 1; i >= 0; i--) {

            // Some or all of the byte is variable: keep the leading fixed bits, set the trailing variable ones.
            if (variableBits > 0) {
                maxBytes[i] = (byte) (baseBytes[i] | TRAILING_MAX_BITS[Math.min(8, variableBits)]);
            } else {
                maxBytes[i] = baseBytes[i];
            }

            variableBits -= 8;
        }

        return maxBytes;
    }

    /**
     * The maskBits in a provided CIDR refer to the number of leading bits in the binary representation of the IP
     * address component that are fixed. Thus, variableBits refers to the number of remaining (trailing) bits.
     */
    private static int computeVariableBits(final byte[] baseBytes, final int maskBits) {
        return (baseBytes.length == 4 ? 32 : 128) - maskBits;
    }

    static int compareUnsigned(final byte[] a, final byte[] b) {
        assert(a.length == b.length);
        for (int i = 0; i < a.length; i++) {
            if (a[i] != b[i]) {
                return (a[i] & 0xff) - (b[i] & 0xff);
            }
        }
        return 0;
    }

    private static void barf(final String msg) throws IllegalArgumentException {
        throw new IllegalArgumentException(msg);
    }

    @Override
    public String toString() {
        return text;
    }
}
