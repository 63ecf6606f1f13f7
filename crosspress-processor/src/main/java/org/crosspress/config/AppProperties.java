package org.crosspress.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {
    private Processor processor = new Processor();
    private Diagnostics diagnostics = new Diagnostics();

    @Getter
    @Setter
    public static class Processor {
        /**
         * Maximum displayable length of a navigation title. Device profiles may lower it.
         */
        private int maxTitleLength = 50;

        /**
         * Number of pages removed from the start of the spine. The upstream generator
         * always emits a cover page followed by a section index.
         */
        private int leadingSpineEntries = 2;

        /**
         * Optional replacement stylesheet, copied verbatim into the package as stylesheet.css.
         */
        private String stylesheet;

        private List<String> titleSources = new ArrayList<>(List.of("Bloomberg"));

        private long minEpubSize = 1000;
    }

    @Getter
    @Setter
    public static class Diagnostics {
        private String workflowRunId = "local";
        private String gitSha = "unknown";
        private boolean debug = false;
    }
}
