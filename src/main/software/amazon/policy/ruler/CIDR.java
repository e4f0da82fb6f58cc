package software.amazon.policy.ruler;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

/**
 * Supports matching IPv4 and IPv6 addresses against address literals and CIDR blocks. Both are represented as an
 * inclusive range of addresses in network byte order; a literal is a range of one.
 */
public class CIDR {

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

    private final static char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private CIDR() { }

    static boolean isIPv4OrIPv6(String ip) {
        return Constants.IPv4_REGEX.matcher(ip).matches() || Constants.IPv6_REGEX.matcher(ip).matches();
    }

    /**
     * Converts an IP address literal (v4 or v6) into its 4 or 16 bytes. Never performs a DNS lookup.
     * @param ip String alleged to be an IPv4 or IPv6 address literal.
     * @return the address bytes, network order
     * @throws IllegalArgumentException if the argument is not an address literal
     */
    static byte[] ipToBytes(final String ip) {
        if (Constants.IPv4_REGEX.matcher(ip).matches()) {
            return ipv4ToBytes(ip);
        }

        // InetAddress would resolve anything that looks like a hostname, so only hand it strings with a colon, which
        //  it always treats as IPv6 literals. An IPv4-mapped literal (::ffff:a.b.c.d) comes back as its 4 IPv4 bytes.
        byte[] addr = {};
        if (Constants.IPv6_REGEX.matcher(ip).matches()) {
            try {
                addr = InetAddress.getByName(ip).getAddress();
            } catch (UnknownHostException e) {
                barf("Invalid IP address: " + ip);
            }
        }
        if (addr.length != 4 && addr.length != 16) {
            barf("Nonstandard IP address: " + ip);
        }
        return addr;
    }

    private static byte[] ipv4ToBytes(final String ip) {
        final String[] octets = ip.split("\\.");
        final byte[] addr = new byte[4];
        for (int i = 0; i < 4; i++) {
            final int octet = Integer.parseInt(octets[i]);
            if (octet > 255) {
                barf("Invalid IP address: " + ip);
            }
            addr[i] = (byte) octet;
        }
        return addr;
    }

    /**
     * Parses "address/maskBits" into the block of addresses it covers. Host bits set in the address are ignored.
     * @param cidr e.g. 192.168.0.0/24 or 2001:db8::/32
     * @return the covered range
     * @throws IllegalArgumentException if the argument is not a well-formed CIDR
     */
    public static Block cidr(String cidr) throws IllegalArgumentException {

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

        byte[] providedIp = ipToBytes(slashed[0]);
        if (providedIp.length == 4) {
            if (maskBits > 32) {
                barf("IPv4 mask bits must be <= 32");
            }
        } else {
            if (maskBits > 128) {
                barf("IPv6 mask bits must be <= 128");
            }
        }

        return new Block(computeBottomBytes(providedIp, maskBits), computeTopBytes(providedIp, maskBits));
    }

    /**
     * Interprets a policy value first as an address literal, then as a CIDR block.
     * @return the covered range, or null if the value is neither
     */
    @Nullable
    static Block ipOrCidrIfPossible(final String value) {
        if (isIPv4OrIPv6(value)) {
            try {
                final byte[] addr = ipToBytes(value);
                return new Block(addr, addr);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        try {
            return cidr(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * @return the address bytes, or null if the value is not an address literal
     */
    @Nullable
    static byte[] ipToBytesIfPossible(final String value) {
        if (!isIPv4OrIPv6(value)) {
            return null;
        }
        try {
            return ipToBytes(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Calculate the byte representation of the lowest IP address covered by the provided CIDR.
     *
     * @param baseBytes The byte representation of the IP address (left-of-slash) component of the provided CIDR.
     * @param maskBits The integer (right-of-slash) of the provided CIDR.
     * @return The byte representation of the lowest IP address covered by the provided CIDR.
     */
    private static byte[] computeBottomBytes(final byte[] baseBytes, final int maskBits) {

        int variableBits = computeVariableBits(baseBytes, maskBits);

        // Iterate from the least significant byte (right hand side) back to the most significant byte (left hand side).
        byte[] minBytes = new byte[baseBytes.length];
        for (int i = baseBytes.length - 1; i >= 0; i--) {

            // Some or all of the byte is variable: keep the leading fixed bits and zero the trailing variable bits.
            if (variableBits > 0) {
                minBytes[i] = (byte) (baseBytes[i] & LEADING_MIN_BITS[Math.min(8, variableBits)]);
            } else {
                minBytes[i] = baseBytes[i];
            }

            // We're effectively chopping off the least significant byte for next iteration.
            variableBits -= 8;
        }

        return minBytes;
    }

    /**
     * Calculate the byte representation of the highest IP address covered by the provided CIDR.
     *
     * @param baseBytes The byte representation of the IP address (left-of-slash) component of the provided CIDR.
     * @param maskBits The integer (right-of-slash) of the provided CIDR.
     * @return The byte representation of the highest IP address covered by the provided CIDR.
     */
    private static byte[] computeTopBytes(final byte[] baseBytes, final int maskBits) {

        int variableBits = computeVariableBits(baseBytes, maskBits);

        byte[] maxBytes = new byte[baseBytes.length];
        for (int i = baseBytes.length - 1; i >= 0; i--) {

            // Some or all of the byte is variable: keep the leading fixed bits and set the trailing variable bits.
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

    private static void barf(final String msg) throws IllegalArgumentException {
        throw new IllegalArgumentException(msg);
    }

    /**
     * An inclusive range of addresses of a single family.
     */
    @Immutable
    public static final class Block {

        private final byte[] bottom;
        private final byte[] top;

        Block(final byte[] bottom, final byte[] top) {
            this.bottom = bottom.clone();
            this.top = top.clone();
        }

        /**
         * @param address 4 or 16 address bytes
         * @return true if the address is of the same family and lies within the block
         */
        public boolean contains(final byte[] address) {
            if (address.length != bottom.length) {
                return false;
            }
            return Arrays.compareUnsigned(bottom, address) <= 0 && Arrays.compareUnsigned(address, top) <= 0;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Block)) {
                return false;
            }
            final Block other = (Block) o;
            return Arrays.equals(bottom, other.bottom) && Arrays.equals(top, other.top);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(bottom) + Arrays.hashCode(top);
        }

        /**
         * @return bottom and top address in hexadecimal, e.g. 0A000000/0A0000FF
         */
        @Override
        public String toString() {
            return toHex(bottom) + '/' + toHex(top);
        }

        private static String toHex(final byte[] address) {
            final StringBuilder hex = new StringBuilder(address.length * 2);
            for (byte ipByte : address) {
                hex.append(HEX_DIGITS[(ipByte >> 4) & 0x0F]).append(HEX_DIGITS[ipByte & 0x0F]);
            }
            return hex.toString();
        }
    }
}
