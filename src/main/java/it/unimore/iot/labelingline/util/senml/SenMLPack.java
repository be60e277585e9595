package it.unimore.iot.labelingline.util.senml;

import com.fasterxml.jackson.annotation.JsonValue;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.model.SimulationStats;

import java.util.ArrayList;
import java.util.List;

// Rappresenta un pacchetto SenML composto da più record serializzati come array JSON
public class SenMLPack {

    @JsonValue
    private final List<SenMLRecord> records;

    // Inizializza un pacchetto vuoto pronto ad accogliere record SenML
    public SenMLPack() {
        this.records = new ArrayList<>();
    }

    /**
     * Stato di un robot: il primo record porta nome base e timestamp (in secondi),
     * i successivi stato, etichette applicate e flag di guasto.
     */
    public static SenMLPack fromRobotStatus(String baseName, RobotStatus status) {
        SenMLPack pack = new SenMLPack();
        SenMLRecord state = SenMLRecord.text("state", String.valueOf(status.getState()));
        state.setBaseName(baseName);
        state.setTime(status.getTimestamp() / 1000);
        pack.addRecord(state);
        pack.addRecord(SenMLRecord.numeric("labels", status.getLabelsPlaced(), "count"));
        pack.addRecord(SenMLRecord.bool("failed", status.isFailed()));
        if (status.getAxisPosition() != null) {
            pack.addRecord(SenMLRecord.numeric("axis", status.getAxisPosition(), "cm"));
        }
        return pack;
    }

    // Contatori aggregati della linea, con l'efficienza in percentuale
    public static SenMLPack fromStats(String baseName, SimulationStats stats, long timestamp) {
        SenMLPack pack = new SenMLPack();
        SenMLRecord boxes = SenMLRecord.numeric("boxes", stats.getTotalBoxes(), "count");
        boxes.setBaseName(baseName);
        boxes.setTime(timestamp / 1000);
        pack.addRecord(boxes);
        pack.addRecord(SenMLRecord.numeric("items", stats.getTotalItems(), "count"));
        pack.addRecord(SenMLRecord.numeric("labeled", stats.getItemsLabeled(), "count"));
        pack.addRecord(SenMLRecord.numeric("missed", stats.getItemsMissed(), "count"));
        pack.addRecord(SenMLRecord.numeric("failures", stats.getRobotFailures(), "count"));
        pack.addRecord(SenMLRecord.numeric("backups", stats.getBackupActivations(), "count"));
        pack.addRecord(SenMLRecord.numeric("efficiency", stats.efficiency(), "%"));
        return pack;
    }

    // Restituisce l'elenco di record contenuti nel pacchetto
    public List<SenMLRecord> getRecords() {
        return records;
    }

    // Aggiunge un record SenML alla lista da serializzare
    public void addRecord(SenMLRecord record) {
        this.records.add(record);
    }
}
