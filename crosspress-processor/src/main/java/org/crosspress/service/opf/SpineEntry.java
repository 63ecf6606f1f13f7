package org.crosspress.service.opf;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpineEntry {
    private String idref;

    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    public boolean isLinear() {
        return !"no".equals(attributes.get("linear"));
    }
}
