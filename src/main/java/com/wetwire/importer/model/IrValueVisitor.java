package com.wetwire.importer.model;

/**
 * Visitor pattern interface for traversing IR values.
 */
public interface IrValueVisitor<R> {
    R visitScalar(IrScalar scalar);
    R visitList(IrList list);
    R visitMap(IrMap map);
    R visitIntrinsic(Intrinsic intrinsic);
}
