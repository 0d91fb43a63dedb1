package org.linescan.yaml;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.Construct;
import org.yaml.snakeyaml.constructor.ConstructorException;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;

/**
 * Safe constructor that resolves the annotated tree into plain maps, lists and scalars, turning
 * every {@link ProvenanceNode} into an {@link AnnotatedScalar}.
 * <p>
 * Every failure while building a value surfaces as a {@link ConstructorException} marked with
 * the offending node, e.g. malformed base64 in a <code>!!binary</code> scalar.
 */
public class AnnotatedConstructor extends SafeConstructor {

    private final Construct annotatedScalarConstruct = new ConstructAnnotatedScalar();

    public AnnotatedConstructor(LoaderOptions options) {
        super(options);
    }

    @Override
    protected Construct getConstructor(Node node) {
        if (node instanceof ProvenanceNode) {
            return new MarkedConstruct(annotatedScalarConstruct);
        }
        return new MarkedConstruct(super.getConstructor(node));
    }

    private class ConstructAnnotatedScalar extends AbstractConstruct {
        @Override
        public Object construct(Node node) {
            ProvenanceNode provenance = (ProvenanceNode) node;
            // str -> String, binary -> byte[]
            Object value = constructObject(provenance.getValueNode());
            return new AnnotatedScalar(value, provenance.getLine(), provenance.getOriginalKey());
        }
    }

    /**
     * Rethrows runtime failures of a delegate construct as marked YAML errors.
     */
    private static final class MarkedConstruct implements Construct {

        private final Construct delegate;

        MarkedConstruct(Construct delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object construct(Node node) {
            try {
                return delegate.construct(node);
            } catch (YAMLException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ValueConstructionException(node, e);
            }
        }

        @Override
        public void construct2ndStep(Node node, Object object) {
            try {
                delegate.construct2ndStep(node, object);
            } catch (YAMLException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ValueConstructionException(node, e);
            }
        }
    }

    /**
     * A value could not be built from its node.
     */
    public static final class ValueConstructionException extends ConstructorException {

        ValueConstructionException(Node node, RuntimeException cause) {
            super("while constructing a " + node.getTag(), node.getStartMark(),
                    String.valueOf(cause.getMessage()), node.getStartMark(), cause);
        }
    }
}
