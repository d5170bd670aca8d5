package com.gridintel.generation.service;

import com.gridintel.generation.model.Region;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Three-layer region assignment for generator units:
 * <ol>
 *   <li>exact match in the externally maintained unit → region table,</li>
 *   <li>first region (in table order) whose keyword occurs in the unit name,</li>
 *   <li>{@link Region#UNKNOWN}.</li>
 * </ol>
 * Pure and total: every unit name yields exactly one region.
 */
@Component
public class RegionResolver {

    private static final Map<Region, List<String>> KEYWORDS = keywordTable();

    public Region resolve(String unitName, Map<String, Region> staticMap) {
        if (unitName != null && staticMap != null) {
            Region mapped = staticMap.get(unitName);
            if (mapped != null) return mapped;
        }
        return inferFromKeywords(unitName);
    }

    public Region inferFromKeywords(String unitName) {
        if (unitName == null || unitName.isEmpty()) return Region.UNKNOWN;
        for (Map.Entry<Region, List<String>> entry : KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (unitName.contains(keyword)) return entry.getKey();
            }
        }
        return Region.UNKNOWN;
    }

    // Order matters: first matching region wins, e.g. 彰 is only reached after every North keyword.
    private static Map<Region, List<String>> keywordTable() {
        Map<Region, List<String>> m = new LinkedHashMap<>();
        m.put(Region.NORTH, List.of("林口", "大潭", "新桃", "通霄", "協和", "石門", "翡翠", "桂山", "觀音", "龍潭", "北部"));
        m.put(Region.CENTRAL, List.of("台中", "大甲溪", "明潭", "彰工", "中港", "竹南", "苗栗", "雲林", "麥寮", "中部", "彰"));
        m.put(Region.SOUTH, List.of("興達", "大林", "南部", "核三", "曾文", "嘉義", "台南", "高雄", "永安", "屏東"));
        m.put(Region.EAST, List.of("和平", "花蓮", "蘭陽", "卑南", "立霧", "東部"));
        m.put(Region.ISLANDS, List.of("澎湖", "金門", "馬祖", "塔山", "離島"));
        m.put(Region.OTHER, List.of("汽電共生", "其他台電自有", "其他購電太陽能", "其他購電風力", "購買地熱", "台電自有地熱", "生質能"));
        return m;
    }
}
