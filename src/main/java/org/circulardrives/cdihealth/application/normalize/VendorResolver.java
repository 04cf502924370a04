package org.circulardrives.cdihealth.application.normalize;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves a vendor name from a model string when the tool reports no explicit vendor.
 *
 * <p>First tries brand names appearing as a whole word anywhere in the model (e.g. {@code "Samsung SSD 870"});
 * then model-number prefixes used by vendors that omit their name (e.g. {@code "ST4000DM004"}).</p>
 *
 * @since 0.1.0
 */
public final class VendorResolver {
  private static final Map<String, String> BRAND_WORDS = buildBrandWords();
  private static final List<PrefixRule> PREFIX_RULES = List.of(
      new PrefixRule(Pattern.compile("^M[BKM]\\d{3}"), "HPE"),
      new PrefixRule(Pattern.compile("^HUS\\d{2}"), "HGST"),
      new PrefixRule(Pattern.compile("^HU[HS]7"), "HGST"),
      new PrefixRule(Pattern.compile("^SSDS"), "INTEL"),
      new PrefixRule(Pattern.compile("^SSDPE"), "INTEL"),
      new PrefixRule(Pattern.compile("^MZ[-7]"), "SAMSUNG"),
      new PrefixRule(Pattern.compile("^ST\\d"), "SEAGATE"),
      new PrefixRule(Pattern.compile("^TH\\w\\d{2}"), "TOSHIBA"),
      new PrefixRule(Pattern.compile("^MG\\d{2}"), "TOSHIBA"),
      new PrefixRule(Pattern.compile("^WD[C\\d]"), "WESTERN DIGITAL"),
      new PrefixRule(Pattern.compile("^CT\\d"), "CRUCIAL"),
      new PrefixRule(Pattern.compile("^KXG"), "KIOXIA"));

  private VendorResolver() {
    // Utility
  }

  /**
   * Resolves a vendor.
   *
   * @param model model string; may be {@code null}
   * @return upper-case vendor name, or empty when no rule matches
   */
  public static Optional<String> fromModel(String model) {
    if (model == null || model.isBlank()) {
      return Optional.empty();
    }
    String upper = model.trim().toUpperCase(Locale.ROOT);
    for (String word : upper.split("[\\s_]+")) {
      String brand = BRAND_WORDS.get(word);
      if (brand != null) {
        return Optional.of(brand);
      }
    }
    if (upper.startsWith("SK HYNIX")) {
      return Optional.of("SK HYNIX");
    }
    if (upper.startsWith("WESTERN DIGITAL")) {
      return Optional.of("WESTERN DIGITAL");
    }
    if (upper.startsWith("SUPER TALENT")) {
      return Optional.of("SUPER TALENT");
    }
    for (PrefixRule rule : PREFIX_RULES) {
      if (rule.pattern().matcher(upper).find()) {
        return Optional.of(rule.vendor());
      }
    }
    return Optional.empty();
  }

  private static Map<String, String> buildBrandWords() {
    Map<String, String> map = new LinkedHashMap<>();
    for (String brand : List.of(
        "2-POWER", "ADATA", "CORSAIR", "CRUCIAL", "FUJITSU", "GIGABYTE", "HITACHI", "IBM-ESXS", "INTEL",
        "INTENSO", "KINGFAST", "KINGSTON", "KIOXIA", "LEXAR", "LENOVO-X", "LITEON", "MAXTOR", "MICRON",
        "NETAPP", "PATRIOT", "PLEXTOR", "PLIANT", "PIONEER", "SANDISK", "SAMSUNG", "SEAGATE", "SMI", "SONY",
        "SPCC", "TOSHIBA", "TRANSCEND", "DELL", "EMC", "HGST", "HPE", "HP", "IBM", "PNY")) {
      map.put(brand, brand);
    }
    map.put("WDC", "WESTERN DIGITAL");
    map.put("WD", "WESTERN DIGITAL");
    map.put("SUPERTALENT", "SUPER TALENT");
    return Map.copyOf(map);
  }

  private record PrefixRule(Pattern pattern, String vendor) {}
}
