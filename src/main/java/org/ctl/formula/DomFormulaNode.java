package org.ctl.formula;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Implementazione di {@link FormulaNode} costruita da un elemento DOM.
 *
 * La conversione è completa e anticipata: dopo la costruzione il nodo non mantiene
 * riferimenti al DOM, quindi l'albero può essere condiviso tra thread in sola lettura.
 */
public final class DomFormulaNode implements FormulaNode {

    private final String tag;
    private final String namespace;
    private final NodeKind kind;
    private final List<FormulaNode> children;
    private final String text;

    private DomFormulaNode(String tag, String namespace, NodeKind kind, List<FormulaNode> children, String text) {
        this.tag = tag;
        this.namespace = namespace;
        this.kind = kind;
        this.children = children;
        this.text = text;
    }

    /**
     * Costruisce ricorsivamente la vista dell'intero sottoalbero di un elemento.
     * Commenti, istruzioni di elaborazione e spazi tra elementi vengono ignorati.
     *
     * @param element elemento radice (non null)
     * @return nodo immutabile equivalente
     */
    public static DomFormulaNode fromElement(Element element) {
        if (element == null) {
            throw new IllegalArgumentException("Elemento DOM null non convertibile in nodo formula");
        }

        String localName = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
        String namespace = element.getNamespaceURI();
        NodeKind kind = NodeKind.classify(namespace, localName);

        List<FormulaNode> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n instanceof Element) {
                children.add(fromElement((Element) n));
            }
        }

        String text = null;
        if (children.isEmpty()) {
            String content = element.getTextContent();
            if (content != null && !content.isBlank()) {
                text = content.trim();
            }
        }

        return new DomFormulaNode(localName, namespace, kind, Collections.unmodifiableList(children), text);
    }

    @Override
    public String getTag() {
        return tag;
    }

    @Override
    public String getNamespace() {
        return namespace;
    }

    @Override
    public NodeKind getKind() {
        return kind;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return children;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return text != null ? tag + "[" + text + "]" : tag;
        }
        return tag + children;
    }
}
