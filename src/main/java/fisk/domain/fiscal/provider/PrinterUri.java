package fisk.domain.fiscal.provider;

/**
 * Parsed printer URI {@code <scheme>://<port>[?baudRate=<n>]}
 * @param baudRate 0 when the URI does not name one
 * @since 15/10/2026
 */
public record PrinterUri(EProtocol protocol, String port, int baudRate) {
    private static final String SEPARATOR = "://";
    private static final String BAUD_RATE = "baudRate";

    public static PrinterUri parse(String uri) {
        if (uri == null || uri.trim().isEmpty()) {
            throw new IllegalArgumentException("Printer URI cannot be empty");
        }
        int schemeEnd = uri.indexOf(SEPARATOR);
        if (schemeEnd <= 0) {
            throw new IllegalArgumentException("Printer URI has no scheme: " + uri);
        }
        EProtocol protocol = EProtocol.fromScheme(uri.substring(0, schemeEnd));

        String rest = uri.substring(schemeEnd + SEPARATOR.length());
        int baudRate = 0;
        int query = rest.indexOf('?');
        if (query >= 0) {
            baudRate = parseBaudRate(rest.substring(query + 1), uri);
            rest = rest.substring(0, query);
        }
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("Printer URI has no port: " + uri);
        }
        return new PrinterUri(protocol, rest, baudRate);
    }

    private static int parseBaudRate(String query, String uri) {
        for (String parameter : query.split("&")) {
            String[] pair = parameter.split("=", 2);
            if (pair.length == 2 && pair[0].equals(BAUD_RATE)) {
                try {
                    return Integer.parseInt(pair[1]);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid baud rate in printer URI: " + uri, e);
                }
            }
        }
        return 0;
    }

    @Override
    public String toString() {
        String uri = protocol.getScheme() + SEPARATOR + port;
        return baudRate > 0 ? uri + "?" + BAUD_RATE + "=" + baudRate : uri;
    }
}
