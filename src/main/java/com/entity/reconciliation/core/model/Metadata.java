package com.entity.reconciliation.core.model;

import java.util.Objects;

/**
 * Optional facts gathered about an asset: network ownership, location, registration and
 * cloud placement. Every field is a string; empty means unknown.
 */
public class Metadata {
    private String asnumber;
    private String asname;
    private String asrange;
    private String country;
    private String province;
    private String city;
    private String purchased;
    private String updated;
    private String expiration;
    private String registrant;
    private String registrar;
    private String email;
    private String cloudService;
    private String cloudId;
    private String cloudRoot;
    private String cloudAccount;

    public Metadata() {
    }

    Metadata(Metadata other) {
        this.asnumber = other.asnumber;
        this.asname = other.asname;
        this.asrange = other.asrange;
        this.country = other.country;
        this.province = other.province;
        this.city = other.city;
        this.purchased = other.purchased;
        this.updated = other.updated;
        this.expiration = other.expiration;
        this.registrant = other.registrant;
        this.registrar = other.registrar;
        this.email = other.email;
        this.cloudService = other.cloudService;
        this.cloudId = other.cloudId;
        this.cloudRoot = other.cloudRoot;
        this.cloudAccount = other.cloudAccount;
    }

    /**
     * Copies every non-empty field of {@code other}.
     */
    public void merge(Metadata other) {
        copyKnown(other);
    }

    /**
     * Same as {@link #merge(Metadata)}: a visit can only add knowledge.
     */
    public void visit(Metadata other) {
        copyKnown(other);
    }

    private void copyKnown(Metadata other) {
        asnumber = pick(asnumber, other.asnumber);
        asname = pick(asname, other.asname);
        asrange = pick(asrange, other.asrange);
        country = pick(country, other.country);
        province = pick(province, other.province);
        city = pick(city, other.city);
        purchased = pick(purchased, other.purchased);
        updated = pick(updated, other.updated);
        expiration = pick(expiration, other.expiration);
        registrant = pick(registrant, other.registrant);
        registrar = pick(registrar, other.registrar);
        email = pick(email, other.email);
        cloudService = pick(cloudService, other.cloudService);
        cloudId = pick(cloudId, other.cloudId);
        cloudRoot = pick(cloudRoot, other.cloudRoot);
        cloudAccount = pick(cloudAccount, other.cloudAccount);
    }

    private static String pick(String current, String incoming) {
        return incoming == null || incoming.isEmpty() ? current : incoming;
    }

    /**
     * Autonomous system number.
     */
    public String getAsNumber() {
        return asnumber;
    }

    public void setAsNumber(String asnumber) {
        this.asnumber = asnumber;
    }

    /**
     * Autonomous system name.
     */
    public String getAsName() {
        return asname;
    }

    public void setAsName(String asname) {
        this.asname = asname;
    }

    /**
     * Autonomous system IP range.
     */
    public String getAsRange() {
        return asrange;
    }

    public void setAsRange(String asrange) {
        this.asrange = asrange;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getProvince() {
        return province;
    }

    public void setProvince(String province) {
        this.province = province;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    /**
     * Registration purchase date, RFC 3339.
     */
    public String getPurchased() {
        return purchased;
    }

    public void setPurchased(String purchased) {
        this.purchased = purchased;
    }

    public String getUpdated() {
        return updated;
    }

    public void setUpdated(String updated) {
        this.updated = updated;
    }

    public String getExpiration() {
        return expiration;
    }

    public void setExpiration(String expiration) {
        this.expiration = expiration;
    }

    public String getRegistrant() {
        return registrant;
    }

    public void setRegistrant(String registrant) {
        this.registrant = registrant;
    }

    public String getRegistrar() {
        return registrar;
    }

    public void setRegistrar(String registrar) {
        this.registrar = registrar;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getCloudService() {
        return cloudService;
    }

    public void setCloudService(String cloudService) {
        this.cloudService = cloudService;
    }

    public String getCloudId() {
        return cloudId;
    }

    public void setCloudId(String cloudId) {
        this.cloudId = cloudId;
    }

    public String getCloudRoot() {
        return cloudRoot;
    }

    public void setCloudRoot(String cloudRoot) {
        this.cloudRoot = cloudRoot;
    }

    public String getCloudAccount() {
        return cloudAccount;
    }

    public void setCloudAccount(String cloudAccount) {
        this.cloudAccount = cloudAccount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Metadata that = (Metadata) o;
        return Objects.equals(asnumber, that.asnumber)
                && Objects.equals(asname, that.asname)
                && Objects.equals(asrange, that.asrange)
                && Objects.equals(country, that.country)
                && Objects.equals(province, that.province)
                && Objects.equals(city, that.city)
                && Objects.equals(purchased, that.purchased)
                && Objects.equals(updated, that.updated)
                && Objects.equals(expiration, that.expiration)
                && Objects.equals(registrant, that.registrant)
                && Objects.equals(registrar, that.registrar)
                && Objects.equals(email, that.email)
                && Objects.equals(cloudService, that.cloudService)
                && Objects.equals(cloudId, that.cloudId)
                && Objects.equals(cloudRoot, that.cloudRoot)
                && Objects.equals(cloudAccount, that.cloudAccount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(asnumber, asname, asrange, country, province, city, purchased, updated, expiration, registrant, registrar, email, cloudService, cloudId, cloudRoot, cloudAccount);
    }
}
