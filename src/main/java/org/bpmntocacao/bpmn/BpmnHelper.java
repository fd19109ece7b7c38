package org.bpmntocacao.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.bpmntocacao.bpmn.models.BpmnDefinitions;
import org.bpmntocacao.bpmn.models.FlowNode;
import org.bpmntocacao.bpmn.models.FlowNodeType;
import org.bpmntocacao.bpmn.models.ProcessDef;
import org.bpmntocacao.bpmn.models.SequenceFlow;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
public class BpmnHelper {
    private static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    private static final String CAMUNDA_NS = "http://camunda.org/schema/1.0/bpmn";
    private static final String DISALLOW_DOCTYPE_FEATURE = "http://apache.org/xml/features/disallow-doctype-decl";

    /**
     * Parses a BPMN file and returns a BpmnDefinitions object instance.
     *
     * @param bpmnFilePath the path to the BPMN file
     * @return BpmnDefinitions object containing the parsed BPMN structure
     * @throws RuntimeException if parsing fails
     */
    public static BpmnDefinitions parseBpmnFile(String bpmnFilePath) {
        File file = new File(bpmnFilePath);
        if (!file.isFile()) {
            throw new IllegalArgumentException("BPMN file not found: " + bpmnFilePath);
        }
        try (InputStream in = new FileInputStream(file)) {
            return parseBpmn(in);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read BPMN file: " + bpmnFilePath, e);
        } catch (RuntimeException e) {
            throw new RuntimeException("Failed to parse BPMN file: " + bpmnFilePath, e);
        }
    }

    /**
     * Parses BPMN XML held in memory.
     */
    public static BpmnDefinitions parseBpmnString(String bpmnXml) {
        return parseDocument(new InputSource(new StringReader(bpmnXml)));
    }

    /**
     * Parses BPMN XML from a stream. The stream is not closed.
     */
    public static BpmnDefinitions parseBpmn(InputStream in) {
        return parseDocument(new InputSource(in));
    }

    private static BpmnDefinitions parseDocument(InputSource source) {
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            // input files are user supplied: no DTDs, no external entities
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature(DISALLOW_DOCTYPE_FEATURE, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            doc = builder.parse(source);
        } catch (Exception e) {
            throw new IllegalArgumentException("Malformed BPMN document: " + e.getMessage(), e);
        }

        // Get root definitions element
        Element definitionsEl = doc.getDocumentElement();
        if (!"definitions".equals(definitionsEl.getLocalName()) || !BPMN_NS.equals(definitionsEl.getNamespaceURI())) {
            throw new IllegalArgumentException("Root element is not BPMN 'definitions'");
        }

        List<ProcessDef> processes = new ArrayList<>();
        for (Element processEl : childElements(definitionsEl, "process")) {
            processes.add(parseProcess(processEl));
        }

        return new BpmnDefinitions(definitionsEl.getAttribute("id"), processes);
    }

    /**
     * Parses a process element into a ProcessDef object.
     * Only direct children are read; nested sub-process content is left out.
     */
    private static ProcessDef parseProcess(Element processEl) {
        List<SequenceFlow> sequenceFlows = parseSequenceFlows(processEl);

        ProcessDef.ProcessDefBuilder builder = ProcessDef.builder()
                .id(processEl.getAttribute("id"))
                .name(processEl.getAttribute("name"))
                .isExecutable("true".equalsIgnoreCase(processEl.getAttribute("isExecutable")))
                .versionTag(processEl.getAttributeNS(CAMUNDA_NS, "versionTag"))
                .sequenceFlows(sequenceFlows);

        NodeList children = processEl.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() != Node.ELEMENT_NODE || !BPMN_NS.equals(child.getNamespaceURI())) {
                continue;
            }
            Element nodeEl = (Element) child;
            Optional<FlowNodeType> type = FlowNodeType.fromElementName(nodeEl.getLocalName());
            if (type.isEmpty()) {
                if (!"sequenceFlow".equals(nodeEl.getLocalName())) {
                    log.debug("Skipping unsupported BPMN element {} ({})", nodeEl.getLocalName(), nodeEl.getAttribute("id"));
                }
                continue;
            }
            String nodeId = nodeEl.getAttribute("id");
            if (nodeId.isEmpty()) {
                continue;
            }
            builder.flowNode(parseFlowNode(nodeEl, nodeId, type.get(), sequenceFlows));
        }

        return builder.build();
    }

    private static FlowNode parseFlowNode(Element nodeEl, String nodeId, FlowNodeType type, List<SequenceFlow> sequenceFlows) {
        List<String> outgoing = childTexts(nodeEl, "outgoing");
        if (outgoing.isEmpty()) {
            // exporters may omit <outgoing>, fall back to the declared flows
            outgoing = sequenceFlows.stream()
                    .filter(flow -> nodeId.equals(flow.sourceRef()))
                    .map(SequenceFlow::id)
                    .toList();
        }

        List<String> documentation = childTexts(nodeEl, "documentation");

        return FlowNode.builder()
                .id(nodeId)
                .type(type)
                .name(nodeEl.getAttribute("name"))
                .documentation(documentation.isEmpty() ? "" : documentation.get(0))
                .incoming(childTexts(nodeEl, "incoming"))
                .outgoing(outgoing)
                .build();
    }

    /**
     * Parses all sequence flows from a process element.
     *
     * @param processEl the process element
     * @return the sequence flows in declaration order
     */
    private static List<SequenceFlow> parseSequenceFlows(Element processEl) {
        List<SequenceFlow> flows = new ArrayList<>();

        for (Element flowEl : childElements(processEl, "sequenceFlow")) {
            String flowId = flowEl.getAttribute("id");
            if (flowId.isEmpty()) {
                continue;
            }

            flows.add(new SequenceFlow(
                    flowId,
                    flowEl.getAttribute("name"),
                    flowEl.getAttribute("sourceRef"),
                    flowEl.getAttribute("targetRef")));
        }

        return flows;
    }

    private static List<Element> childElements(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE
                    && BPMN_NS.equals(child.getNamespaceURI())
                    && localName.equals(child.getLocalName())) {
                result.add((Element) child);
            }
        }
        return result;
    }

    private static List<String> childTexts(Element parent, String localName) {
        List<String> texts = new ArrayList<>();
        for (Element el : childElements(parent, localName)) {
            String text = el.getTextContent();
            if (text != null && !text.trim().isEmpty()) {
                texts.add(text.trim());
            }
        }
        return texts;
    }
}
