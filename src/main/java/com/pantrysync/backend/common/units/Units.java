package com.pantrysync.backend.common.units;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 廚房單位換算（純函式、無狀態）。
 * - 質量一律換到 g，容量一律換到 ml
 * - 跨家族或任一邊 UNKNOWN：convert() 直接回原值（寬鬆 pass-through），
 *   需要嚴格結果的呼叫端請用 convertIfCompatible() 或先 classify()
 */
public final class Units {
    private Units() {}

    // === 標準換算常數 ===
    private static final double G_PER_OZ = 28.349523125d;
    private static final double G_PER_LB = 453.59237d;

    private static final double ML_PER_TSP = 4.92892159375d;
    private static final double ML_PER_TBSP = 14.78676478125d;
    private static final double ML_PER_FL_OZ = 29.5735295625d;
    private static final double ML_PER_CUP = 236.5882365d;
    private static final double ML_PER_PINT = 473.176473d;
    private static final double ML_PER_QUART = 946.352946d;
    private static final double ML_PER_GALLON = 3785.411784d;

    private static final Map<String, Double> G_PER_UNIT = Map.ofEntries(
            Map.entry("g", 1.0d),
            Map.entry("gram", 1.0d),
            Map.entry("grams", 1.0d),
            Map.entry("mg", 0.001d),
            Map.entry("milligram", 0.001d),
            Map.entry("milligrams", 0.001d),
            Map.entry("kg", 1000.0d),
            Map.entry("kilogram", 1000.0d),
            Map.entry("kilograms", 1000.0d),
            Map.entry("oz", G_PER_OZ),
            Map.entry("ounce", G_PER_OZ),
            Map.entry("ounces", G_PER_OZ),
            Map.entry("lb", G_PER_LB),
            Map.entry("lbs", G_PER_LB),
            Map.entry("pound", G_PER_LB),
            Map.entry("pounds", G_PER_LB)
    );

    private static final Map<String, Double> ML_PER_UNIT = Map.ofEntries(
            Map.entry("ml", 1.0d),
            Map.entry("milliliter", 1.0d),
            Map.entry("milliliters", 1.0d),
            Map.entry("millilitre", 1.0d),
            Map.entry("millilitres", 1.0d),
            Map.entry("l", 1000.0d),
            Map.entry("liter", 1000.0d),
            Map.entry("liters", 1000.0d),
            Map.entry("litre", 1000.0d),
            Map.entry("litres", 1000.0d),
            Map.entry("tsp", ML_PER_TSP),
            Map.entry("teaspoon", ML_PER_TSP),
            Map.entry("teaspoons", ML_PER_TSP),
            Map.entry("tbsp", ML_PER_TBSP),
            Map.entry("tablespoon", ML_PER_TBSP),
            Map.entry("tablespoons", ML_PER_TBSP),
            Map.entry("fl oz", ML_PER_FL_OZ),
            Map.entry("floz", ML_PER_FL_OZ),
            Map.entry("fluid ounce", ML_PER_FL_OZ),
            Map.entry("fluid ounces", ML_PER_FL_OZ),
            Map.entry("cup", ML_PER_CUP),
            Map.entry("cups", ML_PER_CUP),
            Map.entry("pt", ML_PER_PINT),
            Map.entry("pint", ML_PER_PINT),
            Map.entry("pints", ML_PER_PINT),
            Map.entry("qt", ML_PER_QUART),
            Map.entry("quart", ML_PER_QUART),
            Map.entry("quarts", ML_PER_QUART),
            Map.entry("gal", ML_PER_GALLON),
            Map.entry("gallon", ML_PER_GALLON),
            Map.entry("gallons", ML_PER_GALLON)
    );

    // "2"、"2.5 cups"、"1,5 l"、"500g"；數字後面只能接空白或文字，"1/2"、"1-2"、"1.2.3" 不算數字
    private static final Pattern QTY_TEXT =
            Pattern.compile("^([+-]?\\d+(?:[.,]\\d+)?)(?:\\s+|(?=\\p{L})|$)(.*)$");

    /** 小寫 + trim + 壓縮空白；null → "" */
    static String normalize(String unit) {
        if (unit == null) return "";
        return unit.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    public static UnitFamily classify(String unit) {
        String k = normalize(unit);
        if (G_PER_UNIT.containsKey(k)) return UnitFamily.MASS;
        if (ML_PER_UNIT.containsKey(k)) return UnitFamily.VOLUME;
        return UnitFamily.UNKNOWN;
    }

    public static CanonicalQuantity toCanonical(double value, String unit) {
        UnitFamily family = classify(unit);
        Double factor = factorOf(family, normalize(unit));
        return new CanonicalQuantity(factor == null ? value : value * factor, family);
    }

    /** 反向：g / ml → 目標單位；目標單位 UNKNOWN 時原值回傳 */
    public static double fromCanonical(double canonicalValue, String targetUnit) {
        UnitFamily family = classify(targetUnit);
        Double factor = factorOf(family, normalize(targetUnit));
        return factor == null ? canonicalValue : canonicalValue / factor;
    }

    /**
     * 同一個已知家族才真的換算；否則原值回傳（寬鬆策略，不丟例外）。
     */
    public static double convert(double value, String fromUnit, String toUnit) {
        UnitFamily from = classify(fromUnit);
        if (!from.isKnown() || from != classify(toUnit)) return value;
        return fromCanonical(toCanonical(value, fromUnit).value(), toUnit);
    }

    /**
     * 嚴格版：
     * - 同一個已知家族 → 換算後的值
     * - 單位字面相同（含兩邊都空）→ 原值
     * - 其他 → empty（呼叫端自行決定要跳過還是放行）
     */
    public static OptionalDouble convertIfCompatible(double value, String fromUnit, String toUnit) {
        UnitFamily from = classify(fromUnit);
        if (from.isKnown() && from == classify(toUnit)) {
            return OptionalDouble.of(convert(value, fromUnit, toUnit));
        }
        if (isSameUnitText(fromUnit, toUnit)) return OptionalDouble.of(value);
        return OptionalDouble.empty();
    }

    /** null / 空白視為 ""，比較時忽略大小寫與前後空白 */
    public static boolean isSameUnitText(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    /**
     * 解析「數字 + 可選單位」的自由文字；空白、開頭不是數字、或數字後面黏著符號 → empty。
     * 逗號小數（歐洲寫法）視同小數點。
     */
    public static Optional<ParsedQuantity> parseQuantity(String text) {
        if (text == null) return Optional.empty();
        String s = text.trim();
        if (s.isEmpty()) return Optional.empty();

        Matcher m = QTY_TEXT.matcher(s);
        if (!m.matches()) return Optional.empty();
        try {
            double v = Double.parseDouble(m.group(1).replace(',', '.'));
            return Optional.of(new ParsedQuantity(v, m.group(2).trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * 顯示用：最多 3 位小數、去掉尾端 0，例如 1.0 → "1"、49.99999 → "50"、2.25 → "2.25"
     */
    public static String formatAmount(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return String.valueOf(v);
        BigDecimal bd = BigDecimal.valueOf(v).setScale(3, RoundingMode.HALF_UP).stripTrailingZeros();
        if (bd.signum() == 0) return "0";
        return bd.toPlainString();
    }

    private static Double factorOf(UnitFamily family, String normalizedUnit) {
        return switch (family) {
            case MASS -> G_PER_UNIT.get(normalizedUnit);
            case VOLUME -> ML_PER_UNIT.get(normalizedUnit);
            case UNKNOWN -> null;
        };
    }
}
