package fisk.domain.fiscal;

import java.util.ArrayList;
import java.util.List;

/**
 * Identity and protocol limits of a connected fiscal device
 * @since 14/10/2026
 */
public class DeviceInfo {
    private String uri = "";
    private String serialNumber = "";
    private String fiscalMemorySerialNumber = "";
    private String manufacturer = "";
    private String model = "";
    private String firmwareVersion = "";
    private int itemTextMaxLength;
    private int commentTextMaxLength;
    private int operatorPasswordMaxLength;
    private List<EPaymentType> supportedPaymentTypes = new ArrayList<>();

    public DeviceInfo() {
    }

    public DeviceInfo(DeviceInfo other) {
        this.uri = other.uri;
        this.serialNumber = other.serialNumber;
        this.fiscalMemorySerialNumber = other.fiscalMemorySerialNumber;
        this.manufacturer = other.manufacturer;
        this.model = other.model;
        this.firmwareVersion = other.firmwareVersion;
        this.itemTextMaxLength = other.itemTextMaxLength;
        this.commentTextMaxLength = other.commentTextMaxLength;
        this.operatorPasswordMaxLength = other.operatorPasswordMaxLength;
        this.supportedPaymentTypes = new ArrayList<>(other.supportedPaymentTypes);
    }

    public String getUri() {
        return uri;
    }
    public void setUri(String uri) {
        this.uri = uri;
    }

    public String getSerialNumber() {
        return serialNumber;
    }
    public void setSerialNumber(String serialNumber) {
        this.serialNumber = serialNumber;
    }

    public String getFiscalMemorySerialNumber() {
        return fiscalMemorySerialNumber;
    }
    public void setFiscalMemorySerialNumber(String fiscalMemorySerialNumber) {
        this.fiscalMemorySerialNumber = fiscalMemorySerialNumber;
    }

    public String getManufacturer() {
        return manufacturer;
    }
    public void setManufacturer(String manufacturer) {
        this.manufacturer = manufacturer;
    }

    public String getModel() {
        return model;
    }
    public void setModel(String model) {
        this.model = model;
    }

    public String getFirmwareVersion() {
        return firmwareVersion;
    }
    public void setFirmwareVersion(String firmwareVersion) {
        this.firmwareVersion = firmwareVersion;
    }

    public int getItemTextMaxLength() {
        return itemTextMaxLength;
    }
    public void setItemTextMaxLength(int itemTextMaxLength) {
        this.itemTextMaxLength = itemTextMaxLength;
    }

    public int getCommentTextMaxLength() {
        return commentTextMaxLength;
    }
    public void setCommentTextMaxLength(int commentTextMaxLength) {
        this.commentTextMaxLength = commentTextMaxLength;
    }

    public int getOperatorPasswordMaxLength() {
        return operatorPasswordMaxLength;
    }
    public void setOperatorPasswordMaxLength(int operatorPasswordMaxLength) {
        this.operatorPasswordMaxLength = operatorPasswordMaxLength;
    }

    public List<EPaymentType> getSupportedPaymentTypes() {
        return supportedPaymentTypes;
    }
    public void setSupportedPaymentTypes(List<EPaymentType> supportedPaymentTypes) {
        this.supportedPaymentTypes = supportedPaymentTypes;
    }

    @Override
    public String toString() {
        return String.format("DeviceInfo{uri='%s', serialNumber='%s', fm='%s', model='%s'}",
                uri, serialNumber, fiscalMemorySerialNumber, model);
    }
}
