package fisk.domain.fiscal;

/**
 * @since 14/10/2026
 */
public record Credentials(String operator, String operatorPassword) {

    public static Credentials empty() {
        return new Credentials("", "");
    }
}
