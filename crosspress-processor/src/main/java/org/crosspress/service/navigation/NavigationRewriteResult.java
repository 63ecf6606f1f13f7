package org.crosspress.service.navigation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NavigationRewriteResult {
    private int labelsSeen;
    private int labelsRewritten;

    /**
     * Labels of top-level entries that group nested entries.
     */
    @Builder.Default
    private List<String> sections = new ArrayList<>();
}
