package automaton.graph;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Graphs which can be rendered using the DOT language.
 *
 * @param <V> vertex identifier in the graph
 */
public interface DotGraph<V> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param accepting is this an accepting state?
   * @param group optional cluster the vertex belongs to ({@code null} for none)
   */
  record Vertex<V>(V id, boolean accepting, Integer group) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edges starts (or no vertex if {@code null})
   * @param to vertex where the edges ends
   * @param label label on the edge
   */
  record Edge<V>(V from, V to, String label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  Stream<Edge<V>> edges();

  /**
   * Render a vertex label.
   *
   * @param vertex vertex associated with the label
   * @return HTML label string
   */
  default String renderVertexLabel(Vertex<V> vertex) {
    return escapeHtml(vertex.id().toString());
  }

  /**
   * Render the graph into its DOT source.
   *
   * <p>Parallel edges between the same two vertices are merged into one edge
   * whose label lists every transition label. Vertices with a group are drawn
   * inside a cluster for that group.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    // Vertices, clustered by group
    final var clusters = new LinkedHashMap<Integer, List<Vertex<V>>>();
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      clusters.computeIfAbsent(vertex.group(), k -> new ArrayList<>()).add(vertex);
    }
    for (var cluster : clusters.entrySet()) {
      final String indent = cluster.getKey() == null ? "  " : "    ";
      if (cluster.getKey() != null) {
        builder.append("  subgraph " + escapeId("cluster_" + cluster.getKey()) + " {\n");
        builder.append("    label = <class " + cluster.getKey() + ">;\n");
      }
      for (Vertex<V> vertex : cluster.getValue()) {
        final var id = escapeId(vertex.id().toString());
        final var shape = vertex.accepting() ? "doublecircle" : "circle";
        builder.append(indent + id + " [shape = " + shape + ", label = <" + renderVertexLabel(vertex) + ">];\n");
      }
      if (cluster.getKey() != null) {
        builder.append("  }\n");
      }
    }

    // Edges, merged by endpoints
    int gen = 0;
    final var merged = new LinkedHashMap<Map.Entry<V, V>, List<String>>();
    final Iterable<Edge<V>> es = () -> edges().iterator();
    for (Edge<V> edge : es) {
      merged
        .computeIfAbsent(new SimpleImmutableEntry<>(edge.from(), edge.to()), k -> new ArrayList<>())
        .add(edge.label());
    }
    for (var edge : merged.entrySet()) {
      final V fromV = edge.getKey().getKey();
      final var from = escapeId(fromV == null ? ("_gen" + ++gen) : fromV.toString());
      final var to = escapeId(edge.getKey().getValue().toString());
      final var label = escapeHtml(String.join(", ", edge.getValue()));
      builder.append("  " + from + " -> " + to + " [label = <" + label + ">];\n");
    }

    // Generated (and blank) vertices
    while (gen > 0) {
      final var genId = escapeId("_gen" + gen--);
      builder.append("  " + genId + " [shape = none, label = <>];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID.
   *
   * <p>As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }

  /**
   * Escape text so it can be placed inside an HTML label.
   *
   * @param str raw text
   * @return escaped text
   */
  static String escapeHtml(String str) {
    return str
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;");
  }
}
