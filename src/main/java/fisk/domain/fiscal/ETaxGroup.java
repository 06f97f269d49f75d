package fisk.domain.fiscal;

/**
 * VAT groups. Each protocol maps them to its own token.
 * @since 14/10/2026
 */
public enum ETaxGroup {
    TAX_GROUP_1,
    TAX_GROUP_2,
    TAX_GROUP_3,
    TAX_GROUP_4,
    TAX_GROUP_5,
    TAX_GROUP_6,
    TAX_GROUP_7,
    TAX_GROUP_8
}
