package org.crosspress.service.media;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.crosspress.exception.ProcessingWarning;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaStripResult {
    private int filesRemoved;
    private int failedDeletions;
    private int manifestItemsRemoved;
    private int markupFilesRewritten;
    private int markupElementsRemoved;

    @Builder.Default
    private List<ProcessingWarning> warnings = new ArrayList<>();
}
