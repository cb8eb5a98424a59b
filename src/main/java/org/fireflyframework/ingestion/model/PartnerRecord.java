/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.ingestion.model;

import lombok.EqualsAndHashCode;

import java.util.Map;

/**
 * Source customer or supplier record, mapped onto {@code res.partner}.
 */
@EqualsAndHashCode(callSuper = true)
public class PartnerRecord extends ErpRecord {

    public PartnerRecord(Map<String, ?> fields) {
        super(fields);
    }

    public static PartnerRecord of(Map<String, ?> fields) {
        return new PartnerRecord(fields);
    }

    public String getName() {
        return getString("name");
    }

    public String getEmail() {
        return getString("email");
    }

    public String getPhone() {
        return getString("phone");
    }

    public String getMobile() {
        return getString("mobile");
    }

    public String getVat() {
        return getString("vat");
    }

    public String getStreet() {
        return getString("street");
    }

    public String getCity() {
        return getString("city");
    }

    public String getZip() {
        return getString("zip");
    }

    public String getWebsite() {
        return getString("website");
    }

    public String getCountryCode() {
        return getString("country_code");
    }

    public boolean isCompany() {
        return Boolean.TRUE.equals(getBoolean("is_company"));
    }

    /**
     * Customer rank, {@code 0} when absent.
     */
    public double getCustomerRank() {
        Double rank = getNumber("customer_rank");
        return rank != null ? rank : 0.0;
    }

    /**
     * Supplier rank, {@code 0} when absent.
     */
    public double getSupplierRank() {
        Double rank = getNumber("supplier_rank");
        return rank != null ? rank : 0.0;
    }
}
