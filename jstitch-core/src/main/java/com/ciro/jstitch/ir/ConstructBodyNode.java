package com.ciro.jstitch.ir;

public class ConstructBodyNode extends IrNode {
}
