package com.example.redline.util.sml.signature;

import java.util.ArrayList;
import java.util.List;

/**
 * 数据验证规则签名，按 sqref 中每个区域的首地址登记
 */
public class DataValidationSignature {

    private String cellRange;
    /** list / whole / decimal / date / time / textLength / custom，缺省 none */
    private String validationType = "none";
    private String operator;
    private String formula1;
    private String formula2;
    private boolean allowBlank;
    private boolean showDropDown;
    private boolean showInputMessage;
    private boolean showErrorMessage;
    private String errorTitle;
    private String error;
    private String promptTitle;
    private String prompt;

    /**
     * 参与比较的字段（提示文字不参与）
     */
    public String computeHash() {
        return validationType + "|" + nz(operator) + "|" + nz(formula1) + "|" + nz(formula2)
                + "|" + allowBlank + "|" + showDropDown;
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        parts.add("Type: " + validationType);
        if (operator != null) {
            parts.add("Operator: " + operator);
        }
        if (formula1 != null) {
            parts.add("Formula1: " + formula1);
        }
        if (formula2 != null) {
            parts.add("Formula2: " + formula2);
        }
        return String.join(", ", parts);
    }

    public String getCellRange() { return cellRange; }
    public void setCellRange(String cellRange) { this.cellRange = cellRange; }

    public String getValidationType() { return validationType; }
    public void setValidationType(String validationType) { this.validationType = validationType; }

    public String getOperator() { return operator; }
    public void setOperator(String operator) { this.operator = operator; }

    public String getFormula1() { return formula1; }
    public void setFormula1(String formula1) { this.formula1 = formula1; }

    public String getFormula2() { return formula2; }
    public void setFormula2(String formula2) { this.formula2 = formula2; }

    public boolean isAllowBlank() { return allowBlank; }
    public void setAllowBlank(boolean allowBlank) { this.allowBlank = allowBlank; }

    public boolean isShowDropDown() { return showDropDown; }
    public void setShowDropDown(boolean showDropDown) { this.showDropDown = showDropDown; }

    public boolean isShowInputMessage() { return showInputMessage; }
    public void setShowInputMessage(boolean showInputMessage) { this.showInputMessage = showInputMessage; }

    public boolean isShowErrorMessage() { return showErrorMessage; }
    public void setShowErrorMessage(boolean showErrorMessage) { this.showErrorMessage = showErrorMessage; }

    public String getErrorTitle() { return errorTitle; }
    public void setErrorTitle(String errorTitle) { this.errorTitle = errorTitle; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getPromptTitle() { return promptTitle; }
    public void setPromptTitle(String promptTitle) { this.promptTitle = promptTitle; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }
}
