package eu.okaeri.docstore.entity;

import eu.okaeri.docstore.document.Document;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class Measurement extends Document {

    private Instant createdAt;
    private int anotherId;
    private int intNumber;
    private double floatNumber;
    private boolean active;
    private Integer bonus;
    private MeasurementMeta meta;
}
