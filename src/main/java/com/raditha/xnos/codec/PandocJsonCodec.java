package com.raditha.xnos.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.xnos.compat.CompatibilityProfile;
import com.raditha.xnos.compat.TableLayout;
import com.raditha.xnos.model.AttributeSet;
import com.raditha.xnos.model.BlockContainer;
import com.raditha.xnos.model.Break;
import com.raditha.xnos.model.CitationMode;
import com.raditha.xnos.model.CitationRecord;
import com.raditha.xnos.model.Cite;
import com.raditha.xnos.model.Code;
import com.raditha.xnos.model.Div;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.Header;
import com.raditha.xnos.model.Image;
import com.raditha.xnos.model.InlineContainer;
import com.raditha.xnos.model.Link;
import com.raditha.xnos.model.LinkTarget;
import com.raditha.xnos.model.ListBlock;
import com.raditha.xnos.model.Math;
import com.raditha.xnos.model.MathType;
import com.raditha.xnos.model.Opaque;
import com.raditha.xnos.model.QuoteType;
import com.raditha.xnos.model.Quoted;
import com.raditha.xnos.model.Raw;
import com.raditha.xnos.model.Space;
import com.raditha.xnos.model.Span;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Table;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.model.TokenType;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes pandoc's JSON document format.
 * <p>
 * Two layouts exist: before pandoc 1.18 a document is
 * {@code [{"unMeta": meta}, blocks]}; since then it is
 * {@code {"pandoc-api-version": [...], "meta": meta, "blocks": blocks}}.
 * Elements the engine does not look into are kept as raw JSON.
 */
public class PandocJsonCodec {

    private static final String TYPE = "t";
    private static final String CONTENT = "c";
    private static final String API_VERSION = "pandoc-api-version";

    private final ObjectMapper mapper;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public PandocJsonCodec() {
        this(new ObjectMapper());
    }

    public PandocJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonNode readTree(InputStream in) throws IOException {
        return mapper.readTree(in);
    }

    public JsonNode readTree(String json) throws IOException {
        return mapper.readTree(json);
    }

    /**
     * The document's API version, or {@code null} for the legacy layout.
     */
    public List<Integer> apiVersionOf(JsonNode root) {
        if (root.isObject() && root.has(API_VERSION)) {
            List<Integer> version = new ArrayList<>();
            for (JsonNode part : root.get(API_VERSION)) {
                version.add(part.asInt());
            }
            return version;
        }
        return null;
    }

    public Document decode(JsonNode root, CompatibilityProfile profile) {
        if (root.isArray() && root.size() == 2 && root.get(0).has("unMeta")) {
            return new Document(null, root.get(0).get("unMeta"), decodeList(root.get(1), profile));
        }
        if (root.isObject() && root.has("blocks")) {
            return new Document(apiVersionOf(root), root.get("meta"), decodeList(root.get("blocks"), profile));
        }
        throw new IllegalArgumentException("Not a pandoc JSON document");
    }

    public JsonNode encode(Document document, CompatibilityProfile profile) {
        Encoder encoder = new Encoder(profile, document.isLegacyLayout());
        ArrayNode blocks = encoder.list(document.getBlocks());
        if (document.isLegacyLayout()) {
            ArrayNode root = nodes.arrayNode();
            ObjectNode meta = nodes.objectNode();
            meta.set("unMeta", document.getMeta() == null ? nodes.objectNode() : document.getMeta());
            root.add(meta);
            root.add(blocks);
            return root;
        }
        ObjectNode root = nodes.objectNode();
        ArrayNode version = root.putArray(API_VERSION);
        document.getApiVersion().forEach(version::add);
        root.set("meta", document.getMeta() == null ? nodes.objectNode() : document.getMeta());
        root.set("blocks", blocks);
        return root;
    }

    public void write(Document document, CompatibilityProfile profile, OutputStream out) throws IOException {
        mapper.writeValue(out, encode(document, profile));
    }

    public String writeAsString(Document document, CompatibilityProfile profile) throws IOException {
        return mapper.writeValueAsString(encode(document, profile));
    }

    // Decoding

    private List<Token> decodeList(JsonNode array, CompatibilityProfile profile) {
        requireArray(array, "element list");
        List<Token> tokens = new ArrayList<>();
        for (JsonNode element : array) {
            tokens.add(decodeElement(element, profile));
        }
        return tokens;
    }

    private Token decodeElement(JsonNode element, CompatibilityProfile profile) {
        if (!element.isObject() || !element.has(TYPE)) {
            throw new IllegalArgumentException("Not a pandoc element: " + element);
        }
        String name = element.get(TYPE).asText();
        JsonNode c = element.get(CONTENT);
        TokenType type = TokenType.fromPandocName(name);
        return switch (type) {
            case STR -> new Str(c.asText());
            case SPACE -> new Space();
            case SOFT_BREAK, LINE_BREAK -> new Break(type);
            case EMPH, STRONG, STRIKEOUT, SUPERSCRIPT, SUBSCRIPT, SMALL_CAPS, UNDERLINE, PARA, PLAIN ->
                    new InlineContainer(type, decodeList(c, profile));
            case QUOTED -> new Quoted(QuoteType.fromPandocName(c.get(0).get(TYPE).asText()),
                    decodeList(c.get(1), profile));
            case MATH -> decodeMath(c);
            case CITE -> decodeCite(c, profile);
            case CODE -> new Code(decodeAttributes(c.get(0)), c.get(1).asText());
            case LINK -> {
                boolean attributed = type.isAttributed(c.size());
                int n = attributed ? 1 : 0;
                yield new Link(attributed ? decodeAttributes(c.get(0)) : null,
                        decodeList(c.get(n), profile), decodeTarget(c.get(n + 1)));
            }
            case IMAGE -> {
                boolean attributed = type.isAttributed(c.size());
                int n = attributed ? 1 : 0;
                yield new Image(attributed ? decodeAttributes(c.get(0)) : null,
                        decodeList(c.get(n), profile), decodeTarget(c.get(n + 1)));
            }
            case SPAN -> new Span(decodeAttributes(c.get(0)), decodeList(c.get(1), profile));
            case RAW_INLINE -> Raw.inline(c.get(0).asText(), c.get(1).asText());
            case RAW_BLOCK -> Raw.block(c.get(0).asText(), c.get(1).asText());
            case NOTE, BLOCK_QUOTE -> new BlockContainer(type, decodeList(c, profile));
            case HEADER -> new Header(c.get(0).asInt(), decodeAttributes(c.get(1)), decodeList(c.get(2), profile));
            case DIV -> new Div(decodeAttributes(c.get(0)), decodeList(c.get(1), profile));
            case BULLET_LIST -> new ListBlock(type, null, decodeItems(c, profile));
            case ORDERED_LIST -> new ListBlock(type, c.get(0), decodeItems(c.get(1), profile));
            case TABLE -> decodeTable(c, profile);
            default -> new Opaque(name, c);
        };
    }

    private Math decodeMath(JsonNode c) {
        boolean attributed = TokenType.MATH.isAttributed(c.size());
        int n = attributed ? 1 : 0;
        return new Math(attributed ? decodeAttributes(c.get(0)) : null,
                MathType.fromPandocName(c.get(n).get(TYPE).asText()), c.get(n + 1).asText());
    }

    private Cite decodeCite(JsonNode c, CompatibilityProfile profile) {
        boolean attributed = TokenType.CITE.isAttributed(c.size());
        int n = attributed ? 1 : 0;
        List<CitationRecord> citations = new ArrayList<>();
        for (JsonNode citation : c.get(n)) {
            citations.add(new CitationRecord(
                    citation.get("citationId").asText(),
                    decodeList(citation.get("citationPrefix"), profile),
                    decodeList(citation.get("citationSuffix"), profile),
                    CitationMode.fromPandocName(citation.get("citationMode").get(TYPE).asText()),
                    citation.path("citationNoteNum").asInt(),
                    citation.path("citationHash").asInt()));
        }
        return new Cite(attributed ? decodeAttributes(c.get(0)) : null, citations,
                decodeList(c.get(n + 1), profile));
    }

    private List<List<Token>> decodeItems(JsonNode items, CompatibilityProfile profile) {
        List<List<Token>> decoded = new ArrayList<>();
        for (JsonNode item : items) {
            decoded.add(decodeList(item, profile));
        }
        return decoded;
    }

    private Table decodeTable(JsonNode c, CompatibilityProfile profile) {
        boolean attributed = TokenType.TABLE.isAttributed(c.size());
        JsonNode captionNode = c.get(c.size() - 5);
        JsonNode inlines = captionInlines(captionNode, profile.tableLayout());
        List<Token> caption = inlines == null ? List.of() : decodeList(inlines, profile);
        return new Table(attributed ? decodeAttributes(c.get(0)) : null, caption, c);
    }

    /**
     * The caption's inline list, or {@code null} when the caption holds no block.
     */
    private static JsonNode captionInlines(JsonNode caption, TableLayout layout) {
        if (layout == TableLayout.CAPTION_INLINES) {
            return caption;
        }
        JsonNode blocks = layout == TableLayout.CAPTION_ELEMENT ? caption.path(CONTENT).path(1) : caption.path(1);
        if (!blocks.isArray() || blocks.isEmpty()) {
            return null;
        }
        return blocks.get(0).get(CONTENT);
    }

    private AttributeSet decodeAttributes(JsonNode attr) {
        requireArray(attr, "attributes");
        List<String> classes = new ArrayList<>();
        for (JsonNode cls : attr.get(1)) {
            classes.add(cls.asText());
        }
        List<Map.Entry<String, String>> pairs = new ArrayList<>();
        for (JsonNode kv : attr.get(2)) {
            pairs.add(new AbstractMap.SimpleEntry<>(kv.get(0).asText(), kv.get(1).asText()));
        }
        return AttributeSet.fromPandoc(attr.get(0).asText(), classes, pairs);
    }

    private static LinkTarget decodeTarget(JsonNode target) {
        return new LinkTarget(target.get(0).asText(), target.get(1).asText());
    }

    private static void requireArray(JsonNode node, String what) {
        if (node == null || !node.isArray()) {
            throw new IllegalArgumentException("Expected " + what + " array, got: " + node);
        }
    }

    // Encoding

    /**
     * Writes tokens in the layout of one pandoc version.
     */
    private final class Encoder {

        private final CompatibilityProfile profile;
        private final boolean legacy;

        Encoder(CompatibilityProfile profile, boolean legacy) {
            this.profile = profile;
            this.legacy = legacy;
        }

        ArrayNode list(List<Token> tokens) {
            ArrayNode array = nodes.arrayNode();
            for (Token token : tokens) {
                array.add(element(token));
            }
            return array;
        }

        private ObjectNode element(Token token) {
            if (token instanceof Opaque opaque) {
                ObjectNode node = nodes.objectNode();
                node.put(TYPE, opaque.getName());
                if (opaque.getContent() != null) {
                    node.set(CONTENT, opaque.getContent());
                }
                return node;
            }
            TokenType type = token.type();
            return switch (type) {
                case STR -> tagged(type, nodes.textNode(((Str) token).getText()));
                case SPACE, SOFT_BREAK, LINE_BREAK -> nullary(type.pandocName());
                case EMPH, STRONG, STRIKEOUT, SUPERSCRIPT, SUBSCRIPT, SMALL_CAPS, UNDERLINE, PARA, PLAIN ->
                        tagged(type, list(((InlineContainer) token).getChildren()));
                case QUOTED -> {
                    Quoted quoted = (Quoted) token;
                    yield tagged(type, nodes.arrayNode()
                            .add(nullary(quoted.getQuoteType().pandocName()))
                            .add(list(quoted.getChildren())));
                }
                case MATH -> {
                    Math math = (Math) token;
                    ArrayNode c = withOptionalAttributes(math.getAttributes());
                    c.add(nullary(math.getMathType().pandocName())).add(math.getText());
                    yield tagged(type, c);
                }
                case CITE -> cite((Cite) token);
                case CODE -> {
                    Code code = (Code) token;
                    yield tagged(type, nodes.arrayNode().add(attributes(code.getAttributes())).add(code.getText()));
                }
                case LINK -> {
                    Link link = (Link) token;
                    ArrayNode c = linkAttributes(link.getAttributes());
                    c.add(list(link.getChildren())).add(target(link.getTarget()));
                    yield tagged(type, c);
                }
                case IMAGE -> {
                    Image image = (Image) token;
                    ArrayNode c = linkAttributes(image.getAttributes());
                    c.add(list(image.getCaption())).add(target(image.getTarget()));
                    yield tagged(type, c);
                }
                case SPAN -> {
                    Span span = (Span) token;
                    yield tagged(type, nodes.arrayNode().add(attributes(span.getAttributes()))
                            .add(list(span.getChildren())));
                }
                case RAW_INLINE, RAW_BLOCK -> {
                    Raw raw = (Raw) token;
                    yield tagged(type, nodes.arrayNode().add(raw.getFormat()).add(raw.getText()));
                }
                case NOTE, BLOCK_QUOTE -> tagged(type, list(((BlockContainer) token).getBlocks()));
                case HEADER -> {
                    Header header = (Header) token;
                    yield tagged(type, nodes.arrayNode().add(header.getLevel())
                            .add(attributes(header.getAttributes())).add(list(header.getChildren())));
                }
                case DIV -> {
                    Div div = (Div) token;
                    yield tagged(type, nodes.arrayNode().add(attributes(div.getAttributes()))
                            .add(list(div.getBlocks())));
                }
                case BULLET_LIST, ORDERED_LIST -> listBlock((ListBlock) token);
                case TABLE -> table((Table) token);
                default -> throw new IllegalArgumentException("Cannot encode " + token);
            };
        }

        private ObjectNode cite(Cite cite) {
            ArrayNode citations = nodes.arrayNode();
            for (CitationRecord citation : cite.getCitations()) {
                ObjectNode node = citations.addObject();
                node.put("citationId", citation.id());
                node.set("citationPrefix", list(citation.prefix()));
                node.set("citationSuffix", list(citation.suffix()));
                node.set("citationMode", nullary(citation.mode().pandocName()));
                node.put("citationNoteNum", citation.noteNum());
                node.put("citationHash", citation.hash());
            }
            ArrayNode c = withOptionalAttributes(cite.getAttributes());
            c.add(citations).add(list(cite.getDisplay()));
            return tagged(TokenType.CITE, c);
        }

        private ObjectNode listBlock(ListBlock list) {
            ArrayNode items = nodes.arrayNode();
            for (List<Token> item : list.getItems()) {
                items.add(list(item));
            }
            if (list.is(TokenType.BULLET_LIST)) {
                return tagged(TokenType.BULLET_LIST, items);
            }
            return tagged(TokenType.ORDERED_LIST, nodes.arrayNode().add(list.getListAttributes()).add(items));
        }

        private ObjectNode table(Table table) {
            ArrayNode original = (ArrayNode) table.getContent();
            boolean hadAttributes = TokenType.TABLE.isAttributed(original.size());
            ArrayNode c = nodes.arrayNode();
            if (table.hasAttributes() || profile.hasNativeAttributes(TokenType.TABLE)) {
                c.add(attributes(table.getAttributes()));
            }
            for (int i = hadAttributes ? 1 : 0; i < original.size(); i++) {
                JsonNode field = original.get(i).deepCopy();
                c.add(field);
            }
            int at = c.size() - 5;
            c.set(at, caption(c.get(at), table.getCaption()));
            return tagged(TokenType.TABLE, c);
        }

        private JsonNode caption(JsonNode caption, List<Token> inlines) {
            return switch (profile.tableLayout()) {
                case CAPTION_INLINES -> list(inlines);
                case CAPTION_ELEMENT -> {
                    ObjectNode element = (ObjectNode) caption;
                    ((ArrayNode) element.get(CONTENT)).set(1, captionBlocks(element.get(CONTENT).get(1), inlines));
                    yield element;
                }
                case CAPTION_ARRAY -> {
                    ArrayNode array = (ArrayNode) caption;
                    array.set(1, captionBlocks(array.get(1), inlines));
                    yield array;
                }
            };
        }

        private ArrayNode captionBlocks(JsonNode blocks, List<Token> inlines) {
            ArrayNode result = (ArrayNode) blocks;
            if (result.isEmpty()) {
                if (!inlines.isEmpty()) {
                    result.add(tagged(TokenType.PLAIN, list(inlines)));
                }
                return result;
            }
            ((ObjectNode) result.get(0)).set(CONTENT, list(inlines));
            return result;
        }

        private ArrayNode withOptionalAttributes(AttributeSet attrs) {
            ArrayNode c = nodes.arrayNode();
            if (attrs != null) {
                c.add(attributes(attrs));
            }
            return c;
        }

        private ArrayNode linkAttributes(AttributeSet attrs) {
            if (attrs == null && profile.hasLinkAttributes()) {
                return nodes.arrayNode().add(attributes(new AttributeSet()));
            }
            return withOptionalAttributes(attrs);
        }

        private ArrayNode attributes(AttributeSet attrs) {
            AttributeSet set = attrs == null ? new AttributeSet() : attrs;
            ArrayNode node = nodes.arrayNode();
            node.add(set.getId());
            ArrayNode classes = node.addArray();
            set.getClasses().forEach(classes::add);
            ArrayNode kvs = node.addArray();
            for (Map.Entry<String, String> kv : set.getKvs().entrySet()) {
                kvs.addArray().add(kv.getKey()).add(kv.getValue());
            }
            return node;
        }

        private ArrayNode target(LinkTarget target) {
            return nodes.arrayNode().add(target.url()).add(target.title());
        }

        private ObjectNode tagged(TokenType type, JsonNode content) {
            ObjectNode node = nodes.objectNode();
            node.put(TYPE, type.pandocName());
            node.set(CONTENT, content);
            return node;
        }

        /**
         * A constructor without fields. The legacy layout writes an empty content array.
         */
        private ObjectNode nullary(String name) {
            ObjectNode node = nodes.objectNode();
            node.put(TYPE, name);
            if (legacy) {
                node.putArray(CONTENT);
            }
            return node;
        }
    }
}
