package com.memsearch.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.memsearch.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 按文件扩展名把语料文件加载为内存语料。
 *
 * <ul>
 *     <li>{@code .txt}：每行一个文档，制表符分隔，第一列为 body，第二列（可选）为 meta，空行忽略</li>
 *     <li>{@code .xml}：每个 {@code <doc>} 节点的直接文本子节点以空格拼接为 body</li>
 *     <li>{@code .json}：每行一个 JSON 对象，不以 {@code {} 开头的行忽略</li>
 * </ul>
 */
public class CorpusLoader {
    private static final Logger logger = LoggerFactory.getLogger(CorpusLoader.class);

    private static final String BODY_FIELD = "body";

    private final ObjectReader jsonReader;

    public CorpusLoader() {
        this(new ObjectMapper());
    }

    /**
     * 每行必须恰好是一个 JSON 对象，对象之后的多余内容视为格式错误。
     */
    public CorpusLoader(ObjectMapper objectMapper) {
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * 加载语料文件。
     *
     * @param file 语料文件
     * @return 文档ID从0连续分配的内存语料
     * @throws IOException 文件读取失败、格式损坏或扩展名不受支持时抛出
     */
    public InMemoryCorpus load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("语料文件不能为空");
        }
        String fileName = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        InMemoryCorpus corpus;
        if (fileName.endsWith(".txt")) {
            corpus = loadText(file);
        } else if (fileName.endsWith(".xml")) {
            corpus = loadXml(file);
        } else if (fileName.endsWith(".json")) {
            corpus = loadJson(file);
        } else {
            throw new IOException("不支持的语料格式: " + file);
        }
        logger.info("已加载语料 {}，文档数 {}", file, corpus.size());
        return corpus;
    }

    private InMemoryCorpus loadText(Path file) throws IOException {
        InMemoryCorpus corpus = new InMemoryCorpus();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String[] anonymousFields = line.strip().split("\t");
                if (anonymousFields.length == 1 && anonymousFields[0].isEmpty()) {
                    continue;
                }
                Map<String, String> namedFields = new LinkedHashMap<>();
                namedFields.put(BODY_FIELD, anonymousFields[0]);
                if (anonymousFields.length >= 2) {
                    namedFields.put(Constants.META_FIELD, anonymousFields[1]);
                }
                corpus.addDocument(new Document(corpus.size(), namedFields));
            }
        }
        return corpus;
    }

    private InMemoryCorpus loadXml(Path file) throws IOException {
        org.w3c.dom.Document dom;
        try (InputStream inputStream = Files.newInputStream(file)) {
            dom = newDocumentBuilder().parse(inputStream);
        } catch (SAXException | ParserConfigurationException exception) {
            throw new IOException("XML语料解析失败: " + file, exception);
        }

        InMemoryCorpus corpus = new InMemoryCorpus();
        NodeList docNodes = dom.getElementsByTagName("doc");
        for (int index = 0; index < docNodes.getLength(); index++) {
            Element docElement = (Element) docNodes.item(index);
            corpus.addDocument(Document.of(corpus.size(), BODY_FIELD, directText(docElement)));
        }
        return corpus;
    }

    /**
     * 拼接节点的直接文本子节点，不下探子元素。
     */
    private String directText(Element element) {
        List<String> data = new ArrayList<>();
        NodeList children = element.getChildNodes();
        for (int index = 0; index < children.getLength(); index++) {
            Node child = children.item(index);
            if (child.getNodeType() == Node.TEXT_NODE) {
                data.add(child.getNodeValue());
            }
        }
        return String.join(" ", data);
    }

    private DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setExpandEntityReferences(false);
        return factory.newDocumentBuilder();
    }

    private InMemoryCorpus loadJson(Path file) throws IOException {
        InMemoryCorpus corpus = new InMemoryCorpus();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (!trimmed.startsWith("{")) {
                    logger.debug("跳过非JSON对象行: {}:{}", file, lineNumber);
                    continue;
                }
                corpus.addDocument(new Document(corpus.size(), parseFields(trimmed, file, lineNumber)));
            }
        }
        return corpus;
    }

    private Map<String, String> parseFields(String line, Path file, int lineNumber) throws IOException {
        JsonNode root;
        try {
            root = jsonReader.readTree(line);
        } catch (JsonProcessingException exception) {
            throw new IOException("JSON语料解析失败: " + file + ":" + lineNumber, exception);
        }
        Map<String, String> namedFields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode value = entry.getValue();
            namedFields.put(entry.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return namedFields;
    }
}
