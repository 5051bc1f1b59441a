package com.stylgebra.node;

import com.stylgebra.error.NotYetSupportedException;
import com.stylgebra.numeric.NumberTheory;

/**
 * Algebraic structures and their distinguished elements.
 */
public sealed interface Structure extends Node
    permits Structure.RationalNumbers, Structure.PrimitiveRootOfUnity, Structure.CyclotomicField,
    Structure.GaloisGroup, Structure.IntResidue {

    /**
     * The field of rational numbers. Use the {@link #QQ} instance.
     */
    record RationalNumbers(Meta meta) implements Structure {
        @Override
        public NodeKind kind() {
            return NodeKind.RATIONAL_NUMBERS;
        }

        @Override
        public RationalNumbers withMeta(Meta meta) {
            return new RationalNumbers(meta);
        }
    }

    RationalNumbers QQ = new RationalNumbers(Meta.of("\\mathbb{Q}", "QQ"));

    /**
     * A primitive root of unity of the given order, which may be unknown (null).
     */
    record PrimitiveRootOfUnity(Node order, Meta meta) implements Structure {
        public PrimitiveRootOfUnity {
            if (meta == null || meta.name() == null) {
                meta = new Meta("\\zeta", meta == null ? null : meta.id(),
                    meta == null ? null : meta.defaultStyle());
            }
        }

        public PrimitiveRootOfUnity(Object order) {
            this(order == null ? null : Nodes.wrap(order), Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PRIMITIVE_ROOT_OF_UNITY;
        }

        @Override
        public PrimitiveRootOfUnity withMeta(Meta meta) {
            return new PrimitiveRootOfUnity(order, meta);
        }
    }

    /**
     * The cyclotomic field {@code Q(zeta_m)}. Order and generator are both null when the
     * field is left unspecified.
     */
    record CyclotomicField(Node order, PrimitiveRootOfUnity generator, RationalNumbers baseField, Meta meta)
        implements Structure {
        public CyclotomicField {
            if (baseField == null) {
                baseField = QQ;
            }
            if (meta == null) {
                meta = Meta.NONE;
            }
        }

        /**
         * The field of {@code m}-th roots of unity, generated by a fresh {@code \zeta}.
         */
        public static CyclotomicField ofOrder(Object m, String name) {
            Node order = Nodes.wrap(m);
            return new CyclotomicField(order, new PrimitiveRootOfUnity(order, Meta.NONE), QQ, Meta.named(name));
        }

        public static CyclotomicField generatedBy(PrimitiveRootOfUnity generator) {
            return new CyclotomicField(generator.order(), generator, QQ, Meta.NONE);
        }

        public boolean isPrime() {
            return order instanceof IntegerLiteral m && m.isPrime();
        }

        /**
         * The order's numerical value, or null if it has none.
         */
        public Long orderValue() {
            return order instanceof IntegerLiteral m ? m.value() : null;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CYCLOTOMIC_FIELD;
        }

        @Override
        public CyclotomicField withMeta(Meta meta) {
            return new CyclotomicField(order, generator, baseField, meta);
        }
    }

    record GaloisGroup(Structure extension, Structure baseField, Meta meta) implements Structure {
        public GaloisGroup {
            if (baseField == null) {
                baseField = QQ;
            }
            if (meta == null) {
                meta = Meta.NONE;
            }
        }

        public GaloisGroup(Structure extension, String name) {
            this(extension, QQ, Meta.named(name));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GALOIS_GROUP;
        }

        @Override
        public GaloisGroup withMeta(Meta meta) {
            return new GaloisGroup(extension, baseField, meta);
        }
    }

    /**
     * A residue class modulo a prime.
     */
    record IntResidue(long residue, long modulus, Meta meta) implements Structure {
        public IntResidue {
            if (!NumberTheory.isPrime(modulus)) {
                throw new NotYetSupportedException(
                    "Integer residues are not yet supported for non-prime modulus " + modulus);
            }
            if (meta == null) {
                meta = Meta.NONE;
            }
        }

        /**
         * The least non-negative representative.
         */
        public long value() {
            return Math.floorMod(residue, modulus);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INT_RESIDUE;
        }

        @Override
        public IntResidue withMeta(Meta meta) {
            return new IntResidue(residue, modulus, meta);
        }
    }
}
