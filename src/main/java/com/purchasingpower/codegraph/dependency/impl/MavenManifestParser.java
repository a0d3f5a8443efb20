package com.purchasingpower.codegraph.dependency.impl;

import com.purchasingpower.codegraph.dependency.ManifestParser;
import com.purchasingpower.codegraph.exception.ManifestParseException;
import com.purchasingpower.codegraph.model.dependency.Coordinate;
import com.purchasingpower.codegraph.model.dependency.ManifestFormat;
import com.purchasingpower.codegraph.util.Placeholders;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * pom.xml reader.
 *
 * <p>Versions written as {@code ${property}} are resolved against the manifest's
 * own {@code <properties>} and project coordinates; an entry whose version stays
 * unresolved is dropped. A dependency without a version takes the one declared
 * for it under {@code <dependencyManagement>}.
 */
@Slf4j
@Component
public class MavenManifestParser implements ManifestParser {

    @Override
    public ManifestFormat format() {
        return ManifestFormat.MAVEN;
    }

    @Override
    public List<Coordinate> parse(String manifestPath, String content) {
        Element project = parseXml(manifestPath, content).getDocumentElement();
        Map<String, String> properties = readProperties(project);
        Map<String, String> managedVersions = readManagedVersions(project, properties);

        List<Coordinate> coordinates = new ArrayList<>();
        NodeList dependencies = project.getElementsByTagNameNS("*", "dependency");
        for (int i = 0; i < dependencies.getLength(); i++) {
            Element dependency = (Element) dependencies.item(i);
            String group = Placeholders.resolve(childText(dependency, "groupId"), properties, Placeholders.MAVEN);
            String artifact = Placeholders.resolve(childText(dependency, "artifactId"), properties, Placeholders.MAVEN);
            if (group == null || artifact == null) {
                log.debug("Skipping dependency without resolvable coordinates in {}", manifestPath);
                continue;
            }

            String rawVersion = childText(dependency, "version");
            String version = rawVersion == null
                    ? managedVersions.get(group + ":" + artifact)
                    : Placeholders.resolve(rawVersion, properties, Placeholders.MAVEN);
            if (version == null) {
                log.debug("Dropping {}:{} in {}: version {} unresolved", group, artifact, manifestPath, rawVersion);
                continue;
            }
            coordinates.add(new Coordinate(group, artifact, version));
        }

        log.debug("📦 {}: {} versioned dependencies", manifestPath, coordinates.size());
        return coordinates;
    }

    private Document parseXml(String manifestPath, String content) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder().parse(new InputSource(new StringReader(content)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ManifestParseException(manifestPath, "Invalid pom.xml " + manifestPath + ": " + e.getMessage(), e);
        }
    }

    private Map<String, String> readProperties(Element project) {
        Map<String, String> properties = new HashMap<>();

        Element propertiesElement = child(project, "properties");
        if (propertiesElement != null) {
            for (Element property : children(propertiesElement)) {
                properties.put(property.getLocalName(), property.getTextContent().trim());
            }
        }

        Element parent = child(project, "parent");
        String parentVersion = parent == null ? null : childText(parent, "version");
        String parentGroup = parent == null ? null : childText(parent, "groupId");
        String version = firstNonNull(childText(project, "version"), parentVersion);
        String groupId = firstNonNull(childText(project, "groupId"), parentGroup);

        putIfPresent(properties, "project.version", version);
        putIfPresent(properties, "version", version);
        putIfPresent(properties, "pom.version", version);
        putIfPresent(properties, "project.groupId", groupId);
        putIfPresent(properties, "project.artifactId", childText(project, "artifactId"));
        putIfPresent(properties, "project.parent.version", parentVersion);
        putIfPresent(properties, "project.parent.groupId", parentGroup);
        return properties;
    }

    private Map<String, String> readManagedVersions(Element project, Map<String, String> properties) {
        Map<String, String> managed = new HashMap<>();
        Element management = child(project, "dependencyManagement");
        Element dependencies = management == null ? null : child(management, "dependencies");
        if (dependencies == null) {
            return managed;
        }
        for (Element dependency : children(dependencies)) {
            String group = Placeholders.resolve(childText(dependency, "groupId"), properties, Placeholders.MAVEN);
            String artifact = Placeholders.resolve(childText(dependency, "artifactId"), properties, Placeholders.MAVEN);
            String version = Placeholders.resolve(childText(dependency, "version"), properties, Placeholders.MAVEN);
            if (group != null && artifact != null && version != null) {
                managed.putIfAbsent(group + ":" + artifact, version);
            }
        }
        return managed;
    }

    private static List<Element> children(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i).getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) nodes.item(i));
            }
        }
        return elements;
    }

    private static Element child(Element parent, String localName) {
        for (Element element : children(parent)) {
            if (localName.equals(element.getLocalName())) {
                return element;
            }
        }
        return null;
    }

    private static String childText(Element parent, String localName) {
        Element element = child(parent, localName);
        if (element == null) {
            return null;
        }
        String text = element.getTextContent().trim();
        return text.isEmpty() ? null : text;
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    private static void putIfPresent(Map<String, String> properties, String key, String value) {
        if (value != null) {
            properties.putIfAbsent(key, value);
        }
    }
}
