package com.raditha.xnos.util;

import com.raditha.xnos.model.Cite;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.Header;
import com.raditha.xnos.model.Image;
import com.raditha.xnos.model.InlineContainer;
import com.raditha.xnos.model.Span;
import com.raditha.xnos.model.Table;
import com.raditha.xnos.model.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Maps a token to the inline lists it holds for a set of container kinds.
 * Every pass that rewrites inline lists in place finds them through here.
 */
public final class TokenContainers {

    private TokenContainers() {
    }

    /**
     * The live inline lists of {@code token} that belong to one of {@code kinds}.
     * The returned lists are the token's own and may be mutated.
     */
    public static List<List<Token>> listsFor(Token token, Set<ContainerKind> kinds) {
        List<List<Token>> lists = new ArrayList<>();
        switch (token.type()) {
            case PARA -> addIf(lists, kinds, ContainerKind.PARA, ((InlineContainer) token).getChildren());
            case PLAIN -> addIf(lists, kinds, ContainerKind.PLAIN, ((InlineContainer) token).getChildren());
            case EMPH -> addIf(lists, kinds, ContainerKind.EMPH, ((InlineContainer) token).getChildren());
            case STRONG -> addIf(lists, kinds, ContainerKind.STRONG, ((InlineContainer) token).getChildren());
            case SPAN -> addIf(lists, kinds, ContainerKind.SPAN, ((Span) token).getChildren());
            case HEADER -> addIf(lists, kinds, ContainerKind.HEADER, ((Header) token).getChildren());
            case IMAGE -> addIf(lists, kinds, ContainerKind.IMAGE_CAPTION, ((Image) token).getCaption());
            case TABLE -> addIf(lists, kinds, ContainerKind.TABLE_CAPTION, ((Table) token).getCaption());
            case CITE -> {
                Cite cite = (Cite) token;
                if (!cite.getCitations().isEmpty()) {
                    addIf(lists, kinds, ContainerKind.CITATION_PREFIX, cite.getCitations().get(0).prefix());
                    addIf(lists, kinds, ContainerKind.CITATION_SUFFIX, cite.getCitations().get(0).suffix());
                }
            }
            default -> {
                // no inline lists of interest
            }
        }
        return lists;
    }

    /**
     * Hand every matching inline list in the document to {@code pass}, parents
     * before the lists nested inside them.
     */
    public static void forEachList(Document document, Set<ContainerKind> kinds, Consumer<List<Token>> pass) {
        forEachList(document.getBlocks(), kinds, pass);
    }

    public static void forEachList(List<Token> tokens, Set<ContainerKind> kinds, Consumer<List<Token>> pass) {
        TokenWalker.walk(tokens, token -> {
            for (List<Token> list : listsFor(token, kinds)) {
                pass.accept(list);
            }
            return null;
        });
    }

    private static void addIf(List<List<Token>> lists, Set<ContainerKind> kinds, ContainerKind kind,
            List<Token> list) {
        if (kinds.contains(kind)) {
            lists.add(list);
        }
    }
}
