package com.tessera.database.adapter.mongo;

import java.util.List;

/**
 * Options for the {@code populate} macro. Null fields fall back to conventions derived from the
 * populated field name: collection {@code <field>s}, local field {@code <field>_id}, foreign field
 * {@code _id}, output field {@code <field>}.
 *
 * @param from related collection
 * @param localField field on this collection holding the reference
 * @param foreignField matched field on the related collection
 * @param as output field
 * @param select related fields to keep, empty for all
 */
public record PopulateOptions(String from, String localField, String foreignField, String as, List<String> select) {

    public PopulateOptions {
        select = select == null ? List.of() : List.copyOf(select);
    }

    public static PopulateOptions defaults() {
        return new PopulateOptions(null, null, null, null, null);
    }

    PopulateOptions resolve(String field) {
        return new PopulateOptions(
                from != null ? from : field + "s",
                localField != null ? localField : field + "_id",
                foreignField != null ? foreignField : "_id",
                as != null ? as : field,
                select);
    }
}
