package fisk.domain.fiscal.provider;

/**
 * Supported command grammars, selected by the URI scheme
 * @since 15/10/2026
 */
public enum EProtocol {
    TREMOL_ZFP("bg.zk.zfp.com"),
    ELTRADE_ISL("bg.ed.isl.com");

    private final String scheme;

    EProtocol(String scheme) {
        this.scheme = scheme;
    }

    public String getScheme() {
        return scheme;
    }

    public static EProtocol fromScheme(String scheme) {
        for (EProtocol protocol : values()) {
            if (protocol.scheme.equalsIgnoreCase(scheme)) {
                return protocol;
            }
        }
        throw new IllegalArgumentException("Unsupported printer URI scheme: " + scheme);
    }
}
