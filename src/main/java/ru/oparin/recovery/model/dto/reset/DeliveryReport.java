package ru.oparin.recovery.model.dto.reset;

import lombok.Getter;
import lombok.ToString;

/**
 * Итоги одного цикла воркера доставки.
 */
@Getter
@ToString
public class DeliveryReport {

    private int fetched;
    private int claimed;
    private int delivered;
    private int retried;
    private int failed;
    private int skipped;

    public DeliveryReport fetched(int count) {
        this.fetched = count;
        return this;
    }

    public void claimed() {
        claimed++;
    }

    public void delivered() {
        delivered++;
    }

    public void retried() {
        retried++;
    }

    public void failed() {
        failed++;
    }

    public void skipped() {
        skipped++;
    }
}
