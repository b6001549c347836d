package org.argverify.logic;

public interface FormulaVisitor<R> {
    R visitPropVar(Formula.PropVar f);
    R visitPredication(Formula.Predication f);
    R visitEquality(Formula.Equality f);
    R visitNot(Formula.Not f);
    R visitBinary(Formula.Binary f);
    R visitQuantified(Formula.Quantified f);
}
