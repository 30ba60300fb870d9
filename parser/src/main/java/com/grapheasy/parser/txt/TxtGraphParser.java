package com.grapheasy.parser.txt;

import com.grapheasy.graph.ElementKind;
import com.grapheasy.graph.Graph;
import com.grapheasy.graph.Node;
import com.grapheasy.parser.DebugFlags;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.GraphParser;
import com.grapheasy.parser.SourceLocation;
import com.grapheasy.parser.scan.DelimiterScanner;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for the native bracket/arrow language:
 *
 * <pre>
 * graph { flow: south; }
 * ( Cities
 *   [ Bonn ] -- train --&gt; [ Berlin ] { color: red; }
 * )
 * [ Berlin ] ==&gt; [ Potsdam ], [ Ulm ]
 * </pre>
 */
public final class TxtGraphParser implements GraphParser {
    private static final Logger LOG = LoggerFactory.getLogger(TxtGraphParser.class);

    private final List<StatementRecognizer> recognizers;

    public TxtGraphParser() {
        this(StatementRecognizers.ORDERED);
    }

    TxtGraphParser(List<StatementRecognizer> recognizers) {
        this.recognizers = List.copyOf(recognizers);
    }

    @Override
    public Graph parse(String sourceName, String text) throws GraphParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(text, "text");

        Graph graph = new Graph();
        Run run = new Run(new TxtParseState(sourceName, graph, DebugFlags.maxNestingDepth()));
        for (LogicalLine line : LogicalLineReader.read(text)) {
            run.state.setLineNumber(line.lineNumber());
            try {
                run.parseLine(line.text());
            } catch (GraphParseException ex) {
                throw ex.locate(SourceLocation.ofLine(sourceName, line.lineNumber()));
            }
        }
        run.state.pendingEdge().failIfPending(sourceName);
        run.state.failIfGroupsOpen();
        graph.edgesIntoGroups();
        return graph;
    }

    /** One parse: the state plus the chain parser bound to it. */
    private final class Run {
        private final TxtParseState state;
        private final ChainParser chains;

        Run(TxtParseState state) {
            this.state = state;
            this.chains = new ChainParser(state, this::parseLine);
        }

        void parseLine(String raw) throws GraphParseException {
            String line = DelimiterScanner.stripLineComment(raw).strip();
            LOG.trace("line {}: {}", state.lineNumber(), line);
            for (StatementRecognizer recognizer : recognizers) {
                Optional<Statement> statement = recognizer.recognize(line, state);
                if (statement.isPresent()) {
                    execute(statement.get());
                    return;
                }
            }
        }

        private void execute(Statement statement) throws GraphParseException {
            Graph graph = state.graph();
            if (statement instanceof Statement.Ignored) {
                return;
            }
            if (statement instanceof Statement.PendingEdgeAttributes pending) {
                state.pendingEdge().mergeAttributes(pending.attributes());
            } else if (statement instanceof Statement.ScopeAttributes scope) {
                applyScope(scope);
            } else if (statement instanceof Statement.GroupOpen open) {
                state.openGroup(open.name());
            } else if (statement instanceof Statement.GroupClose close) {
                state.closeGroup().setAttributes(close.attributes());
            } else if (statement instanceof Statement.Chains chainList) {
                executeChains(chainList.fragments());
            } else {
                throw new IllegalStateException("Unhandled statement " + statement + " for " + graph);
            }
        }

        private void applyScope(Statement.ScopeAttributes scope) {
            Graph graph = state.graph();
            for (Statement.Selector selector : scope.selectors()) {
                ElementKind kind = selector.kind();
                String className = selector.className();
                if (kind == null) {
                    graph.setClassAttributes(ElementKind.NODE, className, scope.attributes());
                    graph.setClassAttributes(ElementKind.EDGE, className, scope.attributes());
                    graph.setClassAttributes(ElementKind.GROUP, className, scope.attributes());
                } else if (className != null) {
                    graph.setClassAttributes(kind, className, scope.attributes());
                } else if (kind == ElementKind.GRAPH) {
                    graph.setGraphAttributes(scope.attributes().copy());
                } else {
                    graph.setDefaultAttributes(kind, scope.attributes());
                }
            }
        }

        /**
         * Runs the fragments of one line. Besides plain chains this handles the comma lists: node-only
         * fragments before an edge fan the first edge out from every listed source, node-only fragments
         * after an edge fan the last edge out to every listed target, and a line of node literals only
         * hands each node's attributes back to the nodes listed before it.
         */
        private void executeChains(List<String> fragments) throws GraphParseException {
            List<Node> sources = new ArrayList<>();
            List<Node> previousList = state.takeLastNodeList();
            if (previousList != null && EdgeOperatorSpec.startsWithOperator(fragments.get(0))) {
                sources.addAll(previousList);
                state.setLastChainNode(previousList.get(0));
            }
            boolean list = fragments.size() > 1 && !state.pendingEdge().isPending();
            if (list && allNodeOnly(fragments)) {
                applyNodeList(fragments);
                return;
            }

            ChainParser.Segment fanout = null;
            List<Node> targets = new ArrayList<>();
            for (String fragment : fragments) {
                if (fanout != null && ChainParser.isNodeOnly(fragment)) {
                    Node target = parseListedNode(fragment);
                    chains.connect(fanout.from(), List.of(target), fanout.spec());
                    targets.add(target);
                    continue;
                }
                fanout = null;
                targets.clear();
                if (list && ChainParser.isNodeOnly(fragment)) {
                    sources.add(parseListedNode(fragment));
                    continue;
                }

                ChainParser.ChainResult result = chains.parseFragment(fragment);
                List<Node> extraSources = List.of();
                if (result.first() != null) {
                    extraSources = ChainParser.without(sources, result.first().from());
                    chains.connect(extraSources, result.first().to(), result.first().spec());
                } else if (result.leftPending()) {
                    state.pendingEdge().addSources(sources);
                }
                if (result.last() != null) {
                    List<Node> from = new ArrayList<>(result.last().from());
                    if (result.segments() == 1) {
                        from.addAll(extraSources);
                    }
                    fanout = new ChainParser.Segment(from, result.last().to(), result.last().spec());
                    targets.add(result.last().to().get(0));
                }
                sources.clear();
            }
            state.setLastNodeList(targets);
        }

        private boolean allNodeOnly(List<String> fragments) throws GraphParseException {
            for (String fragment : fragments) {
                if (!ChainParser.isNodeOnly(fragment)) {
                    return false;
                }
            }
            return true;
        }

        private void applyNodeList(List<String> fragments) throws GraphParseException {
            List<Node> listed = new ArrayList<>();
            for (String fragment : fragments) {
                String text = fragment.strip();
                ChainParser.Element element = chains.parseNode(text, 0);
                if (!element.attributes().isEmpty()) {
                    for (Node previous : listed) {
                        previous.setAttributes(element.attributes().copy());
                    }
                }
                Node node = element.nodes().get(0);
                state.setLastChainNode(node);
                listed.add(node);
            }
            state.setLastNodeList(listed);
        }

        private Node parseListedNode(String fragment) throws GraphParseException {
            ChainParser.Element element = chains.parseNode(fragment.strip(), 0);
            Node node = element.nodes().get(0);
            state.setLastChainNode(node);
            return node;
        }
    }
}
