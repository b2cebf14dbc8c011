package com.mailrules.runtime.fields;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;

import java.util.List;
import java.util.logging.Logger;

/**
 * Extracts the bare mailbox from a raw address header value such as
 * {@code "HR Team <hr@tenmiles.com>"}.
 *
 * <p>Parsing is non-strict. When the header cannot be parsed, or yields no address,
 * the raw value is returned unchanged.
 */
public final class AddressParser {

    private static final Logger logger = Logger.getLogger(AddressParser.class.getName());

    public String bareAddress(String raw) {
        if (raw == null || raw.isBlank()) {
            return raw == null ? "" : raw;
        }
        try {
            InternetAddress[] parsed = InternetAddress.parseHeader(raw, false);
            if (parsed.length > 0) {
                String address = parsed[0].getAddress();
                if (address != null && !address.isBlank()) {
                    return address;
                }
            }
        } catch (AddressException e) {
            logger.fine("Unparsable address header '" + raw + "': " + e.getMessage());
        }
        return raw;
    }

    public List<String> bareAddresses(List<String> raw) {
        return raw.stream().map(this::bareAddress).toList();
    }
}
