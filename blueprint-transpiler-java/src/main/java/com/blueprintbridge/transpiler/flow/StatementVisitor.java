package com.blueprintbridge.transpiler.flow;

import com.blueprintbridge.transpiler.flow.Statement.*;

public interface StatementVisitor<R> {
    R visitCall(CallStatement call);
    R visitAssign(AssignStatement assign);
    R visitBranch(BranchStatement branch);
    R visitLoop(LoopStatement loop);
    R visitReturn(ReturnStatement ret);
    R visitTemporary(TemporaryStatement temporary);
    R visitStub(StubStatement stub);
    R visitCycle(CycleStatement cycle);
}
