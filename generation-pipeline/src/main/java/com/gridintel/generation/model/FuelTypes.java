package com.gridintel.generation.model;

import java.util.List;
import java.util.Map;

/**
 * Native short fuel labels as published in the live feed, mapped to the
 * bilingual labels used in every persisted table.
 */
public final class FuelTypes {

    private static final Map<String, String> BILINGUAL = Map.ofEntries(
            Map.entry("太陽能", "太陽能(Solar)"),
            Map.entry("風力", "風力(Wind)"),
            Map.entry("燃煤", "燃煤(Coal)"),
            Map.entry("燃氣", "燃氣(LNG)"),
            Map.entry("水力", "水力(Hydro)"),
            Map.entry("核能", "核能(Nuclear)"),
            Map.entry("汽電共生", "汽電共生(Co-Gen)"),
            Map.entry("民營電廠-燃煤", "民營電廠-燃煤(IPP-Coal)"),
            Map.entry("民營電廠-燃氣", "民營電廠-燃氣(IPP-LNG)"),
            Map.entry("燃油", "燃油(Oil)"),
            Map.entry("輕油", "輕油(Diesel)"),
            Map.entry("其它再生能源", "其它再生能源(Other Renewable Energy)"),
            Map.entry("儲能", "儲能(Energy Storage System)")
    );

    /** Display order for generation-mix reports. */
    public static final List<String> REPORT_ORDER = List.of(
            "核能(Nuclear)", "燃煤(Coal)", "汽電共生(Co-Gen)", "民營電廠-燃煤(IPP-Coal)",
            "燃氣(LNG)", "民營電廠-燃氣(IPP-LNG)", "燃油(Oil)", "輕油(Diesel)",
            "水力(Hydro)", "風力(Wind)", "太陽能(Solar)", "其它再生能源(Other Renewable Energy)",
            "儲能(Energy Storage System)"
    );

    private FuelTypes() {
    }

    /** Unmapped labels pass through unchanged. */
    public static String toBilingual(String nativeLabel) {
        if (nativeLabel == null) return null;
        String trimmed = nativeLabel.trim();
        return BILINGUAL.getOrDefault(trimmed, trimmed);
    }
}
