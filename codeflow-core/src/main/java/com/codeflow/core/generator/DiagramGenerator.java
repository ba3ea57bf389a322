package com.codeflow.core.generator;

import com.codeflow.core.model.ProgramModel;

import java.util.Set;

/**
 * Interface for generators that turn an analyzed program into a textual artifact.
 *
 * <p>Generators convert the {@link ProgramModel} produced by a front end (the control
 * tree and its flow graph) into a specific output syntax such as Mermaid or JSON. Each
 * generator supports one or more {@link DiagramType}s.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI). They must be
 * stateless so that one instance can serve concurrent conversions.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class DotGenerator implements DiagramGenerator {
 *     @Override
 *     public String getId() {
 *         return "dot";
 *     }
 *
 *     @Override
 *     public Set<DiagramType> getSupportedDiagramTypes() {
 *         return Set.of(DiagramType.FLOWCHART);
 *     }
 *
 *     @Override
 *     public GeneratedDiagram generate(ProgramModel model, DiagramType type, GeneratorConfig config) {
 *         StringBuilder sb = new StringBuilder("digraph flow {\n");
 *         model.graph().edges().forEach(e -> sb.append(e.from()).append(" -> ").append(e.to()).append(";\n"));
 *         return new GeneratedDiagram("flowchart", sb.append("}\n").toString(), "dot");
 *     }
 *     // getDisplayName(), getFileExtension() ...
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codeflow.core.generator.DiagramGenerator}
 *
 * @see ProgramModel
 * @see DiagramType
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for selecting the output format on the command line. Should be lowercase
     * (e.g., "mermaid", "json").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated content.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Returns set of diagram types this generator can produce.
     *
     * @return supported diagram types
     */
    Set<DiagramType> getSupportedDiagramTypes();

    /**
     * Generates output from the program model.
     *
     * @param model the analyzed program
     * @param type the diagram type to generate
     * @param config configuration settings for generation
     * @return generated content
     * @throws IllegalArgumentException if diagram type is not supported
     */
    GeneratedDiagram generate(ProgramModel model, DiagramType type, GeneratorConfig config);
}
