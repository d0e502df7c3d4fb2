package nl.bytesoflife.deltacnc.job;

import nl.bytesoflife.deltacnc.model.MachineCapabilities;
import nl.bytesoflife.deltacnc.model.MachiningParams;
import nl.bytesoflife.deltacnc.model.MaterialStock;
import nl.bytesoflife.deltacnc.model.Tool;
import nl.bytesoflife.deltacnc.model.operation.CircularCutOperation;
import nl.bytesoflife.deltacnc.model.operation.DrillOperation;
import nl.bytesoflife.deltacnc.model.operation.LineCutOperation;
import nl.bytesoflife.deltacnc.tube.VoidBounds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one machining job needs: the stock, the operations, the selected tool,
 * parameters and the target machine.
 */
public class CncJob {

    private MaterialStock material;
    private Tool tool;
    private MachiningParams params;
    private MachineCapabilities capabilities;
    private boolean skipTubeVoid;

    private final List<DrillOperation> drillOperations = new ArrayList<>();
    private final List<CircularCutOperation> circularCuts = new ArrayList<>();
    private final List<LineCutOperation> lineCuts = new ArrayList<>();

    public CncJob material(MaterialStock material) {
        this.material = material;
        return this;
    }

    public CncJob tool(Tool tool) {
        this.tool = tool;
        return this;
    }

    public CncJob params(MachiningParams params) {
        this.params = params;
        return this;
    }

    public CncJob capabilities(MachineCapabilities capabilities) {
        this.capabilities = capabilities;
        return this;
    }

    /**
     * Skip geometry inside the hollow of tube stock. Ignored for flat stock.
     */
    public CncJob skipTubeVoid(boolean skip) {
        this.skipTubeVoid = skip;
        return this;
    }

    public CncJob addDrill(DrillOperation op) {
        drillOperations.add(op);
        return this;
    }

    public CncJob addCircularCut(CircularCutOperation op) {
        circularCuts.add(op);
        return this;
    }

    public CncJob addLineCut(LineCutOperation op) {
        lineCuts.add(op);
        return this;
    }

    public MaterialStock getMaterial() {
        return material;
    }

    public Tool getTool() {
        return tool;
    }

    public MachiningParams getParams() {
        return params;
    }

    public MachineCapabilities getCapabilities() {
        return capabilities;
    }

    /**
     * True when void skipping is requested and the stock actually is a tube.
     */
    public boolean isTubeVoidActive() {
        return skipTubeVoid && material != null && material.isTube();
    }

    /**
     * The void to skip, or null when void skipping is not active.
     */
    public VoidBounds getActiveVoidBounds() {
        return isTubeVoidActive() ? material.tubeProfile().voidBounds() : null;
    }

    public List<DrillOperation> getDrillOperations() {
        return Collections.unmodifiableList(drillOperations);
    }

    public List<CircularCutOperation> getCircularCuts() {
        return Collections.unmodifiableList(circularCuts);
    }

    public List<LineCutOperation> getLineCuts() {
        return Collections.unmodifiableList(lineCuts);
    }
}
