package ai.proofkit.extractor.nlp;

import edu.stanford.nlp.ling.CoreAnnotations;
import edu.stanford.nlp.ling.CoreLabel;
import edu.stanford.nlp.ling.IndexedWord;
import edu.stanford.nlp.pipeline.Annotation;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import edu.stanford.nlp.semgraph.SemanticGraph;
import edu.stanford.nlp.semgraph.SemanticGraphCoreAnnotations;
import edu.stanford.nlp.semgraph.SemanticGraphEdge;
import edu.stanford.nlp.util.CoreMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizer backed by a Stanford CoreNLP pipeline (tokenization, sentence splitting, POS tagging and
 * dependency parsing). The pipeline is built once and shared across calls.
 */
public class CoreNlpProofTokenizer implements ProofTokenizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoreNlpProofTokenizer.class);
    private static final String ANNOTATORS = "tokenize,ssplit,pos,depparse";
    private static final String ROOT_RELATION = "root";
    private static final String UNATTACHED_RELATION = "dep";

    private final StanfordCoreNLP pipeline;

    public CoreNlpProofTokenizer() {
        this(createPipeline());
    }

    CoreNlpProofTokenizer(StanfordCoreNLP pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    static Properties pipelineProperties() {
        Properties properties = new Properties();
        properties.setProperty("annotators", ANNOTATORS);
        properties.setProperty("tokenize.language", "en");
        // keep "+", "=" and friends as separate tokens
        properties.setProperty("tokenize.options", "invertible=true,ptb3Escaping=false");
        return properties;
    }

    private static StanfordCoreNLP createPipeline() {
        long started = System.nanoTime();
        try {
            StanfordCoreNLP pipeline = new StanfordCoreNLP(pipelineProperties());
            LOGGER.info("CoreNLP pipeline ({}) ready in {} ms", ANNOTATORS, (System.nanoTime() - started) / 1_000_000);
            return pipeline;
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize CoreNLP pipeline; are the English models on the classpath?", ex);
        }
    }

    @Override
    public List<Statement> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Annotation document = new Annotation(text);
        pipeline.annotate(document);

        List<CoreMap> sentences = document.get(CoreAnnotations.SentencesAnnotation.class);
        if (sentences == null) {
            return List.of();
        }
        List<Statement> statements = new ArrayList<>(sentences.size());
        for (CoreMap sentence : sentences) {
            String sentenceText = sentenceText(text, sentence);
            statements.add(new Statement(statements.size(), sentenceText, toTokens(sentence)));
        }
        LOGGER.debug("CoreNLP produced {} statements", statements.size());
        return List.copyOf(statements);
    }

    private List<Token> toTokens(CoreMap sentence) {
        List<CoreLabel> labels = sentence.get(CoreAnnotations.TokensAnnotation.class);
        SemanticGraph dependencies = sentence.get(SemanticGraphCoreAnnotations.BasicDependenciesAnnotation.class);
        List<Token> tokens = new ArrayList<>(labels.size());
        for (CoreLabel label : labels) {
            String word = label.word();
            PartOfSpeech category = PartOfSpeech.fromPennTag(label.tag(), word);
            tokens.add(new Token(word, category, relationOf(dependencies, label.index())));
        }
        return tokens;
    }

    private String relationOf(SemanticGraph dependencies, int tokenIndex) {
        if (dependencies == null) {
            return UNATTACHED_RELATION;
        }
        IndexedWord node = dependencies.getNodeByIndexSafe(tokenIndex);
        if (node == null) {
            return UNATTACHED_RELATION;
        }
        if (dependencies.getRoots().contains(node)) {
            return ROOT_RELATION;
        }
        List<SemanticGraphEdge> incoming = dependencies.getIncomingEdgesSorted(node);
        if (incoming.isEmpty()) {
            return UNATTACHED_RELATION;
        }
        return incoming.get(0).getRelation().toString();
    }

    private String sentenceText(String source, CoreMap sentence) {
        Integer begin = sentence.get(CoreAnnotations.CharacterOffsetBeginAnnotation.class);
        Integer end = sentence.get(CoreAnnotations.CharacterOffsetEndAnnotation.class);
        if (begin != null && end != null && begin >= 0 && end <= source.length() && begin <= end) {
            return source.substring(begin, end);
        }
        return sentence.get(CoreAnnotations.TextAnnotation.class);
    }
}
