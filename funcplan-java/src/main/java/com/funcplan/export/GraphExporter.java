package com.funcplan.export;

import com.funcplan.flatten.FlatGraph;

/**
 * Renders a flattened graph into a visual document.
 */
public interface GraphExporter {

    /** File extension of the produced document, also the CLI flag name ({@code html}, {@code svg}). */
    String format();

    /**
     * @param title caption shown with the graph
     * @return the complete document
     * @throws ExportFailedException if the document cannot be produced
     */
    byte[] render(FlatGraph graph, String title);

    default String fileName() {
        return "plan." + format();
    }
}
